package in.tradefuse.domain.signal;

import in.tradefuse.domain.data.Timeframe;

import java.time.Instant;
import java.util.Map;

/**
 * Technical indicator output for one instrument and timeframe.
 *
 * score is already scaled to [-1, 1]; bandWidth is the Bollinger band width
 * used for volatility calibration (0 when unknown).
 */
public record TechnicalResult(
    String instrument,
    Timeframe timeframe,
    ComponentStatus status,
    double score,
    double bandWidth,
    Map<String, Double> indicators,
    Instant observedAt
) {
    public TechnicalResult {
        indicators = indicators == null ? Map.of() : Map.copyOf(indicators);
    }

    public static TechnicalResult present(String instrument, Timeframe timeframe, double score,
                                          double bandWidth, Map<String, Double> indicators, Instant observedAt) {
        return new TechnicalResult(instrument, timeframe, ComponentStatus.PRESENT, score, bandWidth, indicators, observedAt);
    }

    public static TechnicalResult missing(String instrument, Timeframe timeframe) {
        return new TechnicalResult(instrument, timeframe, ComponentStatus.MISSING, 0.0, 0.0, Map.of(), null);
    }

    public TechnicalResult asStale() {
        return new TechnicalResult(instrument, timeframe, ComponentStatus.STALE, score, bandWidth, indicators, observedAt);
    }

    public boolean isUsable() {
        return status.isUsable();
    }
}
