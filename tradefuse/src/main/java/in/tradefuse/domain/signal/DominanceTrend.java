package in.tradefuse.domain.signal;

/**
 * Direction of the reference asset's market dominance between the last two readings.
 */
public enum DominanceTrend {
    RISING,
    FALLING,
    FLAT;

    public static DominanceTrend between(double previousPct, double currentPct, double flatBandPct) {
        double delta = currentPct - previousPct;
        if (delta > flatBandPct) return RISING;
        if (delta < -flatBandPct) return FALLING;
        return FLAT;
    }
}
