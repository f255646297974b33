package in.tradefuse.service.signal;

import in.tradefuse.config.FusionConfig;
import in.tradefuse.domain.signal.ComponentWeights;
import in.tradefuse.domain.signal.DominanceTrend;
import in.tradefuse.domain.signal.FusionResult;
import in.tradefuse.domain.signal.NormalizedComponents;

/**
 * Confidence-Weighted Fuser - combines normalized components into one score.
 *
 * Weight shift = clamp((confidence - 0.5) * slope, -maxShift, +maxShift), added to the forecast
 * weight and subtracted from the technical weight; total weight mass is unchanged.
 *
 * Non-reference instruments get a dominance correction: rising reference dominance pulls the
 * score down, falling dominance pushes it up.
 *
 * Pure function; the result is always in [-1, 1].
 */
public final class ConfidenceWeightedFuser {

    private final FusionConfig config;

    public ConfidenceWeightedFuser(FusionConfig config) {
        this.config = config;
    }

    public FusionResult fuse(NormalizedComponents components, boolean referenceInstrument, DominanceTrend dominanceTrend) {
        ComponentWeights weights = weightsFor(components.forecastConfidence());
        double weighted = components.technical() * weights.technical()
            + components.forecast() * weights.forecast()
            + components.sentiment() * weights.sentiment()
            + components.macro() * weights.macro();
        double adjustment = dominanceAdjustment(referenceInstrument, dominanceTrend);
        double score = Scores.clampUnit(weighted + adjustment);
        return new FusionResult(components, weights, adjustment, score);
    }

    /**
     * Effective weights for a forecast confidence.
     */
    public ComponentWeights weightsFor(double confidence) {
        double shift = Scores.clamp(
            (Scores.clamp(confidence, 0.0, 1.0) - 0.5) * config.confidenceShiftSlope(),
            -config.maxWeightShift(),
            config.maxWeightShift());
        return new ComponentWeights(
            config.technicalWeight() - shift,
            config.forecastWeight() + shift,
            config.sentimentWeight(),
            config.macroWeight());
    }

    double dominanceAdjustment(boolean referenceInstrument, DominanceTrend trend) {
        if (referenceInstrument || trend == null) {
            return 0.0;
        }
        return switch (trend) {
            case RISING -> -config.dominanceCorrection();
            case FALLING -> config.dominanceCorrection();
            case FLAT -> 0.0;
        };
    }
}
