package in.tradefuse.domain.signal;

import java.time.Duration;

/**
 * Look-ahead windows at which past decisions are labeled.
 */
public enum OutcomeWindow {
    H1(Duration.ofHours(1)),
    H4(Duration.ofHours(4)),
    H12(Duration.ofHours(12)),
    D3(Duration.ofDays(3));

    private final Duration length;

    OutcomeWindow(Duration length) {
        this.length = length;
    }

    public Duration getLength() {
        return length;
    }
}
