package in.tradefuse.domain.signal;

/**
 * Output of the confidence-weighted fuser for one instrument and timeframe.
 */
public record FusionResult(
    NormalizedComponents components,
    ComponentWeights weights,
    double macroAdjustment,
    double score
) {
    public boolean isLowConfidence() {
        return components.isLowConfidence();
    }
}
