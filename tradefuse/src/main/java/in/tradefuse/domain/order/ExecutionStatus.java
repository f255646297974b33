package in.tradefuse.domain.order;

public enum ExecutionStatus {
    FILLED,
    SKIPPED,
    VETOED,
    FAILED,
    BOOKKEEPING_FAILED // Order placed but Position/TradeRecord not written; needs manual reconciliation
}
