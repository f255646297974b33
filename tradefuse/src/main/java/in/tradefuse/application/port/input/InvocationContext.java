package in.tradefuse.application.port.input;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-invocation context: identity, deadline and clock of one short-lived unit of work.
 *
 * Work that has not started by the deadline is abandoned; cancellation is implicit.
 */
public record InvocationContext(
    String invocationId,
    Instant deadline,
    Clock clock
) {
    public static InvocationContext withTimeout(Clock clock, Duration timeout) {
        return new InvocationContext(UUID.randomUUID().toString(), clock.instant().plus(timeout), clock);
    }

    public Instant now() {
        return clock.instant();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
