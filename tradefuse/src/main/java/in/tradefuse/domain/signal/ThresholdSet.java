package in.tradefuse.domain.signal;

/**
 * Calibrated decision thresholds for one instrument and cycle.
 *
 * Invariant: -1 &lt;= sellThreshold &lt; buyThreshold &lt;= 1.
 */
public record ThresholdSet(
    String instrument,
    double buyThreshold,
    double sellThreshold,
    double volatilityRatio,
    boolean macroAdjusted
) {
    public ThresholdSet {
        if (sellThreshold >= buyThreshold) {
            throw new IllegalArgumentException(
                "sellThreshold must be below buyThreshold: sell=" + sellThreshold + ", buy=" + buyThreshold);
        }
    }
}
