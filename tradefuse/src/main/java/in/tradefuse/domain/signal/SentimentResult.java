package in.tradefuse.domain.signal;

import java.time.Instant;
import java.util.List;

/**
 * News sentiment for an instrument. rawScore is on [0, 1] with 0.5 neutral.
 */
public record SentimentResult(
    String instrument,
    ComponentStatus status,
    double rawScore,
    List<String> headlines,
    Instant observedAt
) {
    public SentimentResult {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }

    public static SentimentResult present(String instrument, double rawScore, List<String> headlines, Instant observedAt) {
        return new SentimentResult(instrument, ComponentStatus.PRESENT, rawScore, headlines, observedAt);
    }

    public static SentimentResult missing(String instrument) {
        return new SentimentResult(instrument, ComponentStatus.MISSING, 0.5, List.of(), null);
    }

    public boolean isUsable() {
        return status.isUsable();
    }
}
