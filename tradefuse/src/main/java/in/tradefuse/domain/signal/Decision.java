package in.tradefuse.domain.signal;

/**
 * Per-instrument classification of a fused score.
 */
public enum Decision {
    BUY,
    SELL,
    HOLD;

    public boolean isActionable() {
        return this != HOLD;
    }
}
