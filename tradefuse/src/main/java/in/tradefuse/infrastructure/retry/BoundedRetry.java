package in.tradefuse.infrastructure.retry;

import in.tradefuse.application.port.output.ExchangeException;
import in.tradefuse.domain.common.CallResult;
import in.tradefuse.domain.common.ErrorKind;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Uniform retry boundary for read-only external calls.
 *
 * Failures become a {@link CallResult} instead of an exception. A null return value is
 * DATA_UNAVAILABLE and is not retried. Non-retryable {@link ExchangeException}s stop
 * immediately. No retry is started that would end after the invocation deadline.
 *
 * Never wrap order placement with this class.
 */
public final class BoundedRetry {
    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    private final Supplier<RetryPolicy> policyFactory;
    private final Sleeper sleeper;
    private final Clock clock;
    private final EngineMetrics metrics;

    public BoundedRetry(Supplier<RetryPolicy> policyFactory, Sleeper sleeper, Clock clock, EngineMetrics metrics) {
        this.policyFactory = policyFactory;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
    }

    /**
     * Invoke the call with bounded retries.
     *
     * @param operation Name used in logs and metrics
     * @param deadline  Invocation deadline, or null for none
     * @param call      The external call
     */
    public <T> CallResult<T> call(String operation, Instant deadline, Callable<T> call) {
        RetryPolicy policy = policyFactory.get();
        int attempts = 0;
        Exception lastError = null;

        while (policy.shouldRetry()) {
            attempts++;
            try {
                T value = call.call();
                if (value == null) {
                    return CallResult.failure(ErrorKind.DATA_UNAVAILABLE, operation + " returned no data", attempts);
                }
                if (attempts > 1) {
                    log.info("[RETRY] {} succeeded on attempt {}", operation, attempts);
                }
                return CallResult.ok(value, attempts);
            } catch (ExchangeException e) {
                lastError = e;
                if (!e.isRetryable()) {
                    log.warn("[RETRY] {} failed with non-retryable error: {}", operation, e.getMessage());
                    break;
                }
            } catch (Exception e) {
                lastError = e;
            }

            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            Duration delay = policy.getNextDelay();
            if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                log.warn("[RETRY] {} abandoned: next attempt would pass the invocation deadline", operation);
                break;
            }
            log.debug("[RETRY] {} attempt {} failed ({}), retrying in {}ms",
                operation, attempts, lastError.getMessage(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return CallResult.failure(ErrorKind.FATAL, operation + " interrupted", attempts);
            }
        }

        String message = operation + " failed after " + attempts + " attempt(s): "
            + (lastError == null ? "unknown error" : lastError.getMessage());
        log.warn("[RETRY] {}", message);
        metrics.recordExternalCallFailure(operation);
        return CallResult.failure(ErrorKind.EXTERNAL_CALL_FAILURE, message, attempts);
    }
}
