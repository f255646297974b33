package in.tradefuse.domain.signal;

import in.tradefuse.domain.data.Timeframe;

import java.time.Instant;

/**
 * Aggregator input: the fused score of one timeframe and when its data was observed.
 * An unavailable entry carries no usable score.
 */
public record TimeframeScore(
    Timeframe timeframe,
    double score,
    Instant observedAt,
    boolean available
) {
    public static TimeframeScore of(Timeframe timeframe, double score, Instant observedAt) {
        return new TimeframeScore(timeframe, score, observedAt, true);
    }

    public static TimeframeScore unavailable(Timeframe timeframe) {
        return new TimeframeScore(timeframe, 0.0, null, false);
    }
}
