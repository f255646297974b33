package in.tradefuse.domain.signal;

import in.tradefuse.domain.data.Timeframe;

import java.time.Instant;

/**
 * Immutable record of one scoring cycle for one (instrument, timeframe).
 */
public record Signal(
    String instrument,
    Timeframe timeframe,
    Instant timestamp,
    double technical,
    double forecast,
    double sentiment,
    double macro,
    ComponentWeights weights,
    double macroAdjustment,
    double forecastConfidence,
    double fusedScore,
    ThresholdSet thresholds,
    Decision decision,
    boolean lowConfidence
) {
    public static Signal of(String instrument, Timeframe timeframe, Instant timestamp,
                            FusionResult fusion, ThresholdSet thresholds, Decision decision) {
        NormalizedComponents c = fusion.components();
        return new Signal(
            instrument,
            timeframe,
            timestamp,
            c.technical(),
            c.forecast(),
            c.sentiment(),
            c.macro(),
            fusion.weights(),
            fusion.macroAdjustment(),
            c.forecastConfidence(),
            fusion.score(),
            thresholds,
            decision,
            fusion.isLowConfidence()
        );
    }
}
