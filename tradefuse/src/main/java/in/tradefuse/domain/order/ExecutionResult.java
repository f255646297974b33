package in.tradefuse.domain.order;

import in.tradefuse.domain.trade.TradeAction;

/**
 * Outcome of one order request.
 */
public record ExecutionResult(
    String requestId,
    String instrument,
    TradeAction action,
    ExecutionStatus status,
    String detail,
    Fill fill
) {
    public static ExecutionResult filled(OrderRequest request, Fill fill) {
        return new ExecutionResult(request.requestId(), request.instrument(), request.action(),
            ExecutionStatus.FILLED, "filled", fill);
    }

    public static ExecutionResult skipped(OrderRequest request, String detail) {
        return of(request, ExecutionStatus.SKIPPED, detail);
    }

    public static ExecutionResult vetoed(OrderRequest request, String detail) {
        return of(request, ExecutionStatus.VETOED, detail);
    }

    public static ExecutionResult failed(OrderRequest request, String detail) {
        return of(request, ExecutionStatus.FAILED, detail);
    }

    public static ExecutionResult bookkeepingFailed(OrderRequest request, String detail) {
        return of(request, ExecutionStatus.BOOKKEEPING_FAILED, detail);
    }

    private static ExecutionResult of(OrderRequest request, ExecutionStatus status, String detail) {
        return new ExecutionResult(request.requestId(), request.instrument(), request.action(), status, detail, null);
    }

    /**
     * True when a real order reached the exchange for this request.
     */
    public boolean orderPlaced() {
        return status == ExecutionStatus.FILLED || status == ExecutionStatus.BOOKKEEPING_FAILED;
    }
}
