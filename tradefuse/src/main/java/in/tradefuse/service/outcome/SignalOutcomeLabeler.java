package in.tradefuse.service.outcome;

import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.output.CandleFeed;
import in.tradefuse.application.port.output.SignalOutcomeRepository;
import in.tradefuse.application.port.output.SignalRepository;
import in.tradefuse.config.OutcomeConfig;
import in.tradefuse.domain.data.Candle;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.InstrumentDecision;
import in.tradefuse.domain.signal.OutcomeLabel;
import in.tradefuse.domain.signal.OutcomeWindow;
import in.tradefuse.domain.signal.SignalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Labels past BUY/SELL decisions as WIN/LOSS/DRAW once each look-ahead window has elapsed.
 *
 * Price path comes from 15-minute candles between the decision and the end of the window.
 * Entry is the decision's reference price, or the first candle's open when none was recorded.
 * A move within +/- winThresholdPercent is a DRAW. Already-labeled (decision, window) pairs are skipped.
 */
public final class SignalOutcomeLabeler {
    private static final Logger log = LoggerFactory.getLogger(SignalOutcomeLabeler.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    // How far past a window's end a decision is still picked up
    private static final Duration CATCH_UP = Duration.ofDays(2);

    private final OutcomeConfig config;
    private final SignalRepository signalRepo;
    private final SignalOutcomeRepository outcomeRepo;
    private final CandleFeed candleFeed;

    public SignalOutcomeLabeler(OutcomeConfig config, SignalRepository signalRepo,
                                SignalOutcomeRepository outcomeRepo, CandleFeed candleFeed) {
        this.config = config;
        this.signalRepo = signalRepo;
        this.outcomeRepo = outcomeRepo;
        this.candleFeed = candleFeed;
    }

    public LabelingReport run(InvocationContext ctx) {
        Instant now = ctx.now();
        int examined = 0;
        int labeled = 0;
        int skipped = 0;
        int failures = 0;

        for (OutcomeWindow window : config.windows()) {
            Instant to = now.minus(window.getLength());
            Instant from = to.minus(CATCH_UP);
            List<InstrumentDecision> decisions = signalRepo.findActionableDecisions(from, to);
            log.info("[LABELER] window {}: {} decision(s) between {} and {}", window, decisions.size(), from, to);

            for (InstrumentDecision decision : decisions) {
                if (ctx.isExpired()) {
                    log.warn("[LABELER] Deadline reached; remaining decisions left for the next run");
                    return new LabelingReport(examined, labeled, skipped, failures);
                }
                examined++;
                try {
                    if (outcomeRepo.exists(decision.instrument(), decision.timestamp(), window)) {
                        skipped++;
                        continue;
                    }
                    List<Candle> path = candleFeed.candles(decision.instrument(), Timeframe.M15,
                        decision.timestamp(), decision.timestamp().plus(window.getLength()));
                    Optional<SignalOutcome> outcome = label(decision, window, path, now);
                    if (outcome.isEmpty()) {
                        skipped++;
                        continue;
                    }
                    outcomeRepo.save(outcome.get());
                    labeled++;
                } catch (RuntimeException e) {
                    failures++;
                    log.error("[LABELER] {} {} @ {} labeling failed: {}", decision.instrument(), window,
                        decision.timestamp(), e.getMessage(), e);
                }
            }
        }

        LabelingReport report = new LabelingReport(examined, labeled, skipped, failures);
        log.info("[LABELER] ✅ done: {}", report);
        return report;
    }

    /**
     * Label one decision from its price path; empty when there is nothing to measure.
     */
    public Optional<SignalOutcome> label(InstrumentDecision decision, OutcomeWindow window,
                                         List<Candle> path, Instant now) {
        if (!decision.decision().isActionable() || path.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal entry = decision.referencePrice() != null && decision.referencePrice().signum() > 0
            ? decision.referencePrice()
            : path.get(0).open();
        if (entry == null || entry.signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal exit = path.get(path.size() - 1).close();
        BigDecimal high = path.get(0).high();
        BigDecimal low = path.get(0).low();
        for (Candle c : path) {
            high = high.max(c.high());
            low = low.min(c.low());
        }

        double change = pct(entry, exit);
        double up = pct(entry, high);
        double down = -pct(entry, low);
        boolean buy = decision.decision() == Decision.BUY;

        double favorable = buy ? up : down;
        double adverse = buy ? down : up;
        double directional = buy ? change : -change;

        OutcomeLabel label;
        if (directional > config.winThresholdPercent()) {
            label = OutcomeLabel.WIN;
        } else if (directional < -config.winThresholdPercent()) {
            label = OutcomeLabel.LOSS;
        } else {
            label = OutcomeLabel.DRAW;
        }

        return Optional.of(new SignalOutcome(decision.instrument(), decision.timestamp(), window,
            decision.decision(), entry, exit, change, Math.max(0.0, favorable), Math.max(0.0, adverse), label, now));
    }

    private static double pct(BigDecimal from, BigDecimal to) {
        return to.subtract(from).multiply(HUNDRED).divide(from, 8, RoundingMode.HALF_UP).doubleValue();
    }
}
