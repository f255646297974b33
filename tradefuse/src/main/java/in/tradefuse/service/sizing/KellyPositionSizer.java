package in.tradefuse.service.sizing;

import in.tradefuse.application.port.output.TradeRecordRepository;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.config.SizingConfig;
import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.trade.TradeRecord;
import in.tradefuse.domain.trade.TradeStatistics;
import in.tradefuse.service.signal.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Kelly Position Sizer - BUY amount as a fraction of deployable capital.
 *
 * Sizing flow:
 * 1. Trade statistics over the lookback window
 * 2. Fewer than minTradesForKelly round trips: fallback table by score band
 * 3. Otherwise full Kelly; &lt;= 0 means minimum fraction, else Half-Kelly scaled by score strength
 * 4. Clamp to [minFraction, maxFraction]
 * 5. amount = fraction * (free quote - reserve), net of the taker fee
 * 6. Reject when nothing is deployable or the amount is below the minimum order
 */
public final class KellyPositionSizer {
    private static final Logger log = LoggerFactory.getLogger(KellyPositionSizer.class);

    private final SizingConfig config;
    private final TradeRecordRepository tradeRepo;
    private final TradeStatisticsCalculator statsCalculator;

    public KellyPositionSizer(SizingConfig config, TradeRecordRepository tradeRepo) {
        this.config = config;
        this.tradeRepo = tradeRepo;
        this.statsCalculator = new TradeStatisticsCalculator();
    }

    /**
     * Size a BUY.
     *
     * @param score        Aggregated score of the BUY decision
     * @param buyThreshold Calibrated BUY threshold at decision time (NaN when unknown)
     * @param balances     Current exchange balances
     */
    public SizingDecision size(InstrumentConfig instrument, double score, double buyThreshold,
                               Balances balances, Instant now) {
        TradeStatistics stats = statistics(instrument.symbol(), now);

        SizingDecision.Basis basis;
        double fraction;
        double scoreFactor = 1.0;

        if (stats.tradeCount() < config.minTradesForKelly()) {
            basis = SizingDecision.Basis.FALLBACK_TABLE;
            fraction = config.fallbackFraction(score);
        } else {
            KellyCalculator.KellyResult kelly = KellyCalculator.calculateFull(
                BigDecimal.valueOf(stats.winRate()),
                BigDecimal.valueOf(stats.avgWinPct()),
                BigDecimal.valueOf(stats.avgLossPct()),
                BigDecimal.valueOf(config.kellyMultiplier()));
            log.info("[SIZER] {} {} over {} trades", instrument.symbol(), kelly.getSummary(), stats.tradeCount());

            if (!kelly.hasEdge()) {
                basis = SizingDecision.Basis.NO_EDGE;
                fraction = config.minFraction();
            } else {
                basis = SizingDecision.Basis.KELLY;
                scoreFactor = scoreFactor(score, buyThreshold);
                fraction = kelly.workingKelly().doubleValue() * scoreFactor;
            }
        }
        fraction = Scores.clamp(fraction, config.minFraction(), config.maxFraction());

        BigDecimal deployable = deployable(instrument, balances);
        if (deployable.signum() <= 0) {
            log.warn("[SIZER] {} nothing deployable (free={}, reserved={}, reserve={})", instrument.symbol(),
                balances.free(instrument.quoteAsset()), balances.reserved(instrument.quoteAsset()), config.reserveAmount());
            return SizingDecision.rejected(basis, fraction, scoreFactor, deployable, "no deployable capital");
        }

        BigDecimal gross = deployable.multiply(BigDecimal.valueOf(fraction));
        BigDecimal amount = gross
            .divide(BigDecimal.ONE.add(BigDecimal.valueOf(config.takerFeeRate())), 8, RoundingMode.DOWN)
            .setScale(config.amountScale(), RoundingMode.DOWN);

        if (amount.compareTo(config.minOrderAmount()) < 0) {
            log.warn("[SIZER] {} amount {} below minimum order {}", instrument.symbol(), amount, config.minOrderAmount());
            return SizingDecision.rejected(basis, fraction, scoreFactor, deployable,
                "amount " + amount + " below minimum " + config.minOrderAmount());
        }

        log.info("[SIZER] {} basis={} fraction={} scoreFactor={} deployable={} amount={}",
            instrument.symbol(), basis, String.format("%.4f", fraction), String.format("%.2f", scoreFactor),
            deployable, amount);
        return new SizingDecision(basis, fraction, scoreFactor, deployable, amount, false, "ok");
    }

    /**
     * Linear strength factor in [minScoreFactor, 1]: minimum at the BUY threshold, 1 at the strong score.
     */
    public double scoreFactor(double score, double buyThreshold) {
        double strong = config.strongScore();
        if (!Double.isFinite(buyThreshold) || strong <= buyThreshold) {
            return 1.0;
        }
        double strength = Scores.clamp((score - buyThreshold) / (strong - buyThreshold), 0.0, 1.0);
        return config.minScoreFactor() + (1.0 - config.minScoreFactor()) * strength;
    }

    /**
     * Free quote balance minus the fixed reserve. Quote held by open orders is not free and never counted.
     */
    BigDecimal deployable(InstrumentConfig instrument, Balances balances) {
        return balances.free(instrument.quoteAsset()).subtract(config.reserveAmount());
    }

    private TradeStatistics statistics(String instrument, Instant now) {
        Instant since = now.minus(Duration.ofDays(config.lookbackDays()));
        try {
            List<TradeRecord> records = tradeRepo.findByInstrumentSince(instrument, since);
            return statsCalculator.calculate(records);
        } catch (RuntimeException e) {
            log.error("[SIZER] {} trade history unavailable, using fallback table: {}", instrument, e.getMessage(), e);
            return TradeStatistics.empty();
        }
    }
}
