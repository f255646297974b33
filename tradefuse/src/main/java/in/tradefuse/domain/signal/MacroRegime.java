package in.tradefuse.domain.signal;

/**
 * Market-wide mood classification derived from the Fear &amp; Greed index.
 */
public enum MacroRegime {
    EXTREME_FEAR,
    FEAR,
    NEUTRAL,
    GREED,
    EXTREME_GREED;

    public boolean isExtreme() {
        return this == EXTREME_FEAR || this == EXTREME_GREED;
    }

    /**
     * Classify a Fear &amp; Greed index value (0 = extreme fear, 100 = extreme greed).
     */
    public static MacroRegime fromFearGreedIndex(int value) {
        if (value < 25) return EXTREME_FEAR;
        if (value < 45) return FEAR;
        if (value <= 55) return NEUTRAL;
        if (value < 75) return GREED;
        return EXTREME_GREED;
    }
}
