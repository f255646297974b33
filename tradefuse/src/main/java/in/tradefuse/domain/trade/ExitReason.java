package in.tradefuse.domain.trade;

/**
 * Exit reasons for position exits.
 */
public enum ExitReason {
    STOP_LOSS, // Price hit the initial stop loss
    TAKE_PROFIT, // Price reached the take-profit level
    TRAILING_STOP, // Price fell back to a ratcheted trailing stop
    SIGNAL; // Fused score crossed the SELL threshold

    /**
     * Hard protective exits bypass the minimum-hold veto.
     */
    public boolean isForced() {
        return this != SIGNAL;
    }
}
