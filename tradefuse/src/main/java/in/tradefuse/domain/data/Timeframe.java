package in.tradefuse.domain.data;

/**
 * Analysis horizons used for multi-timeframe scoring.
 */
public enum Timeframe {
    /**
     * Short horizon: 15-minute candles.
     * Weight: 0.20, stale after 30 minutes.
     */
    M15(15, 0.20, 30),

    /**
     * Mid horizon: 1-hour candles.
     * Weight: 0.35, stale after 2 hours.
     */
    H1(60, 0.35, 120),

    /**
     * Long horizon: 4-hour candles.
     * Weight: 0.30, stale after 8 hours.
     */
    H4(240, 0.30, 480),

    /**
     * Very long horizon: daily candles.
     * Weight: 0.15, stale after 36 hours.
     */
    D1(1440, 0.15, 2160);

    private final int candleMinutes;
    private final double defaultWeight;
    private final long defaultStaleAfterMinutes;

    Timeframe(int candleMinutes, double defaultWeight, long defaultStaleAfterMinutes) {
        this.candleMinutes = candleMinutes;
        this.defaultWeight = defaultWeight;
        this.defaultStaleAfterMinutes = defaultStaleAfterMinutes;
    }

    public int getCandleMinutes() {
        return candleMinutes;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public long getDefaultStaleAfterMinutes() {
        return defaultStaleAfterMinutes;
    }

    /**
     * Minutes covered by the given number of candles of this timeframe.
     */
    public long minutesFor(int candleCount) {
        return (long) candleMinutes * candleCount;
    }
}
