package in.tradefuse.support;

import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import in.tradefuse.infrastructure.retry.RetryPolicy;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared wiring for service tests: retries without real sleeps and generous deadlines.
 */
public final class TestEngine {

    private TestEngine() {}

    public static BoundedRetry retry(Clock clock) {
        return new BoundedRetry(RetryPolicy::forExternalRead, duration -> {}, clock, null);
    }

    public static InvocationContext context(Clock clock) {
        return InvocationContext.withTimeout(clock, Duration.ofMinutes(4));
    }
}
