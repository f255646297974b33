package in.tradefuse.infrastructure.retry;

import java.time.Duration;

/**
 * Backoff wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
