package in.tradefuse.domain.order;

import java.util.List;

/**
 * Ordered batch of order requests consumed by one execution invocation.
 */
public record OrderBatch(
    String batchId,
    List<OrderRequest> requests
) {
    public OrderBatch {
        requests = requests == null ? List.of() : List.copyOf(requests);
    }
}
