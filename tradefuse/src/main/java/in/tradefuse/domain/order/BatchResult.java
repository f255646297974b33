package in.tradefuse.domain.order;

import java.util.List;

/**
 * Per-request outcomes of one batch, in request order.
 */
public record BatchResult(
    String batchId,
    List<ExecutionResult> results
) {
    public BatchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long count(ExecutionStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public boolean hasFailures() {
        return count(ExecutionStatus.FAILED) > 0 || count(ExecutionStatus.BOOKKEEPING_FAILED) > 0;
    }
}
