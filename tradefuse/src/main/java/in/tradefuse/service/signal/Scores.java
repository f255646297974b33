package in.tradefuse.service.signal;

/**
 * Numeric helpers for [-1, 1] scores.
 */
public final class Scores {

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp to [-1, 1]. Non-finite values collapse to neutral 0.
     */
    public static double clampUnit(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return clamp(value, -1.0, 1.0);
    }

    /**
     * Directional sign with a flat band: +1 above band, -1 below -band, else 0.
     */
    public static int direction(double score, double band) {
        if (score > band) return 1;
        if (score < -band) return -1;
        return 0;
    }

    private Scores() {}
}
