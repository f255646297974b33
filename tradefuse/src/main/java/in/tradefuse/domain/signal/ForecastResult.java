package in.tradefuse.domain.signal;

import in.tradefuse.domain.data.Timeframe;

import java.time.Instant;

/**
 * Forecast component scaled to [-1, 1] together with the model confidence in [0, 1].
 */
public record ForecastResult(
    String instrument,
    Timeframe timeframe,
    ComponentStatus status,
    double score,
    double confidence,
    Instant observedAt
) {
    public static ForecastResult present(String instrument, Timeframe timeframe, double score,
                                         double confidence, Instant observedAt) {
        return new ForecastResult(instrument, timeframe, ComponentStatus.PRESENT, score, confidence, observedAt);
    }

    public static ForecastResult missing(String instrument, Timeframe timeframe) {
        return new ForecastResult(instrument, timeframe, ComponentStatus.MISSING, 0.0, 0.0, null);
    }

    public boolean isUsable() {
        return status.isUsable();
    }
}
