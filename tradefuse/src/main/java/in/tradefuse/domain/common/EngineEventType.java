package in.tradefuse.domain.common;

/**
 * Durable engine events, keyed by instrument and time.
 */
public enum EngineEventType {
    // Position lifecycle
    POSITION_OPENED,
    POSITION_CLOSED,
    PEAK_UPDATED,
    STOP_RAISED,

    // Risk
    CIRCUIT_BREAKER_TRIPPED,
    ORDER_VETOED,

    // Anomalies and failures
    FILL_ANOMALY,
    EXECUTION_FAILURE,
    ALERT
}
