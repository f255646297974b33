package in.tradefuse.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Derived breaker state over the trailing 24h of closed positions.
 *
 * evaluated is false when the inputs could not be read; the state is then open (not tripped).
 */
public record CircuitBreakerState(
    BigDecimal realizedPnl,
    int consecutiveLosses,
    Instant lastLossAt,
    TripReason tripReason,
    boolean evaluated
) {
    public static CircuitBreakerState notEvaluated() {
        return new CircuitBreakerState(BigDecimal.ZERO, 0, null, TripReason.NONE, false);
    }

    public boolean isTripped() {
        return tripReason != TripReason.NONE;
    }
}
