package in.tradefuse.domain.common;

/**
 * Error taxonomy for engine units of work.
 */
public enum ErrorKind {
    /**
     * Upstream signal missing or insufficient. Substitute a neutral default and flag low confidence.
     */
    DATA_UNAVAILABLE,

    /**
     * Data older than its freshness bound. Exclude it; never treat it as a zero score.
     */
    STALE_DATA,

    /**
     * Exchange, model or store call failed after bounded retries.
     */
    EXTERNAL_CALL_FAILURE,

    /**
     * Observed value deviates implausibly from an independent reference.
     */
    DATA_INTEGRITY,

    /**
     * Unexpected failure. Logged, alerted and reported without retry.
     */
    FATAL
}
