package in.tradefuse.domain.trade;

/**
 * Why the circuit breaker is tripped.
 */
public enum TripReason {
    NONE,
    DAILY_LOSS_LIMIT,
    LOSS_STREAK,
    COOLDOWN
}
