package in.tradefuse.service.sizing;

import in.tradefuse.domain.order.FillSource;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TradeRecord;
import in.tradefuse.domain.trade.TradeStatistics;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradeStatisticsCalculatorTest {

    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

    private final TradeStatisticsCalculator calculator = new TradeStatisticsCalculator();

    @Test
    void testPairsBuysAndSellsInOrder() {
        List<TradeRecord> records = List.of(
            record(TradeAction.BUY, "100", "0", 0),
            record(TradeAction.SELL, "104", "0", 1),
            record(TradeAction.BUY, "200", "0", 2),
            record(TradeAction.SELL, "196", "0", 3));

        TradeStatistics stats = calculator.calculate(records);

        assertEquals(2, stats.tradeCount());
        assertEquals(1, stats.wins());
        assertEquals(0.5, stats.winRate(), 1e-9);
        assertEquals(4.0, stats.avgWinPct(), 1e-9);
        assertEquals(2.0, stats.avgLossPct(), 1e-9);
    }

    @Test
    void testRecordsAreSortedByTime() {
        List<TradeRecord> records = List.of(
            record(TradeAction.SELL, "110", "0", 5),
            record(TradeAction.BUY, "100", "0", 1));

        TradeStatistics stats = calculator.calculate(records);

        assertEquals(1, stats.tradeCount());
        assertEquals(10.0, stats.avgWinPct(), 1e-9);
    }

    @Test
    void testUnmatchedSellIsIgnored() {
        TradeStatistics stats = calculator.calculate(List.of(record(TradeAction.SELL, "110", "0", 0)));

        assertEquals(0, stats.tradeCount());
        assertEquals(0.0, stats.winRate());
    }

    @Test
    void testFeesReduceTheReturn() {
        double pct = TradeStatisticsCalculator.roundTripReturnPct(
            record(TradeAction.BUY, "100", "1", 0),
            record(TradeAction.SELL, "110", "1", 1));

        // (109 - 101) / 101
        assertEquals(7.92079208, pct, 1e-6);
    }

    @Test
    void testBreakEvenCountsAsLoss() {
        TradeStatistics stats = calculator.calculate(List.of(
            record(TradeAction.BUY, "100", "0", 0),
            record(TradeAction.SELL, "100", "0", 1)));

        assertEquals(1, stats.tradeCount());
        assertEquals(0, stats.wins());
        assertEquals(0.0, stats.avgLossPct(), 1e-9);
    }

    private static TradeRecord record(TradeAction action, String price, String fee, int hour) {
        return new TradeRecord("eth_jpy", action, BigDecimal.ONE, new BigDecimal(price), new BigDecimal(fee),
            T0.plusSeconds(hour * 3600L), "ord-" + hour, "batch-" + hour, 0.5, null, FillSource.EXCHANGE);
    }
}
