package in.tradefuse.domain.monitoring;

/**
 * Alert severity levels for engine monitoring
 */
public enum AlertLevel {
    /**
     * CRITICAL (P0) - Immediate action required
     * Examples: order placed but bookkeeping failed, execution failure
     */
    CRITICAL,

    /**
     * HIGH (P1) - Action required soon
     * Examples: circuit breaker tripped, corrupt fill price substituted
     */
    HIGH,

    /**
     * MEDIUM (P2) - Review and monitor
     * Examples: fill estimated from balances, exchange holding out of sync with positions
     */
    MEDIUM,

    /**
     * LOW (P3) - Informational
     * Examples: BUY vetoed by portfolio cap
     */
    LOW,

    /**
     * INFO - General information
     */
    INFO;

    /**
     * Levels that are pushed to the notification channel in addition to the log.
     */
    public boolean isNotifiable() {
        return this == CRITICAL || this == HIGH || this == MEDIUM;
    }
}
