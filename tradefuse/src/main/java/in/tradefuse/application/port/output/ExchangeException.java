package in.tradefuse.application.port.output;

/**
 * Exchange call failure.
 *
 * retryable is true for transport-level failures of read-only calls (timeouts, 5xx, rate limits).
 */
public class ExchangeException extends RuntimeException {
    private final boolean retryable;

    public ExchangeException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ExchangeException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
