package in.tradefuse.service.sizing;

import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TradeRecord;
import in.tradefuse.domain.trade.TradeStatistics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Round-trip statistics from an instrument's trade records.
 *
 * Each SELL closes the earliest unmatched BUY before it. Return of a round trip is
 * (sell proceeds - sell fee - buy cost - buy fee) / (buy cost + buy fee), in percent.
 * A zero return counts as a loss of 0%.
 */
public final class TradeStatisticsCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public TradeStatistics calculate(List<TradeRecord> records) {
        List<TradeRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(TradeRecord::timestamp));

        List<TradeRecord> openBuys = new ArrayList<>();
        List<Double> returns = new ArrayList<>();
        for (TradeRecord r : ordered) {
            if (r.action() == TradeAction.BUY) {
                openBuys.add(r);
            } else if (!openBuys.isEmpty()) {
                TradeRecord buy = openBuys.remove(0);
                returns.add(roundTripReturnPct(buy, r));
            }
        }

        if (returns.isEmpty()) {
            return TradeStatistics.empty();
        }

        int wins = 0;
        double winSum = 0;
        double lossSum = 0;
        for (double ret : returns) {
            if (ret > 0) {
                wins++;
                winSum += ret;
            } else {
                lossSum += -ret;
            }
        }
        int losses = returns.size() - wins;
        return new TradeStatistics(
            returns.size(),
            wins,
            (double) wins / returns.size(),
            wins == 0 ? 0.0 : winSum / wins,
            losses == 0 ? 0.0 : lossSum / losses
        );
    }

    static double roundTripReturnPct(TradeRecord buy, TradeRecord sell) {
        // Sized by the sell quantity: partial sells compare like for like
        BigDecimal quantity = sell.quantity().min(buy.quantity());
        BigDecimal buyCost = buy.price().multiply(quantity).add(proRataFee(buy, quantity));
        BigDecimal proceeds = sell.price().multiply(quantity).subtract(proRataFee(sell, quantity));
        if (buyCost.signum() == 0) {
            return 0.0;
        }
        return proceeds.subtract(buyCost).multiply(HUNDRED).divide(buyCost, 8, RoundingMode.HALF_UP).doubleValue();
    }

    private static BigDecimal proRataFee(TradeRecord r, BigDecimal quantity) {
        if (r.fee() == null || r.quantity().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return r.fee().multiply(quantity).divide(r.quantity(), 8, RoundingMode.HALF_UP);
    }
}
