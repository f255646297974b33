package in.tradefuse.domain.common;

import java.util.function.Function;

/**
 * Result of an external call made through a bounded-retry boundary.
 *
 * Exactly one of value / errorKind is set.
 */
public record CallResult<T>(
    T value,
    ErrorKind errorKind,
    String message,
    int attempts
) {
    public static <T> CallResult<T> ok(T value, int attempts) {
        return new CallResult<>(value, null, null, attempts);
    }

    public static <T> CallResult<T> failure(ErrorKind kind, String message, int attempts) {
        return new CallResult<>(null, kind, message, attempts);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public <R> CallResult<R> map(Function<T, R> mapper) {
        if (!isOk()) {
            return new CallResult<>(null, errorKind, message, attempts);
        }
        return new CallResult<>(mapper.apply(value), null, null, attempts);
    }
}
