package in.tradefuse.domain.trade;

/**
 * Rolling round-trip statistics for one instrument.
 *
 * avgWinPct and avgLossPct are both positive magnitudes in percent.
 */
public record TradeStatistics(
    int tradeCount,
    int wins,
    double winRate,
    double avgWinPct,
    double avgLossPct
) {
    public static TradeStatistics empty() {
        return new TradeStatistics(0, 0, 0.0, 0.0, 0.0);
    }
}
