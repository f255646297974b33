package in.tradefuse.application.port.output;

import in.tradefuse.domain.order.OrderBatch;

import java.util.Optional;

/**
 * Consumer side of the order queue.
 */
public interface OrderQueue extends OrderPublisher {

    /**
     * Claim up to maxRequests unclaimed requests, oldest first, as one batch.
     * Claimed requests are never handed out again.
     */
    Optional<OrderBatch> claimBatch(int maxRequests);
}
