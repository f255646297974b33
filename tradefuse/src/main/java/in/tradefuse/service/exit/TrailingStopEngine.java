package in.tradefuse.service.exit;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.input.MonitorTask;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.OrderPublisher;
import in.tradefuse.application.port.output.PositionRepository;
import in.tradefuse.application.port.output.QuoteProvider;
import in.tradefuse.config.EngineConfig;
import in.tradefuse.domain.common.CallResult;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.Position;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring cycle over every open position.
 *
 * Per position:
 * 1. Live quote through the retry boundary
 * 2. Peak and trailing stop ratchet, persisted once when changed
 * 3. Quote at or below the stop: forced SELL (TRAILING_STOP above entry, STOP_LOSS otherwise)
 * 4. Quote at or above take-profit: forced SELL (TAKE_PROFIT)
 *
 * Entry prices are checked against the live quote once, when the fill is booked. Here the
 * recorded levels are trusted as they are: a deep drop below entry is a stop-loss, never a repair.
 * Forced exits ignore the fused score. A failure on one position never stops the cycle.
 */
public final class TrailingStopEngine implements MonitorTask {
    private static final Logger log = LoggerFactory.getLogger(TrailingStopEngine.class);

    private final PositionRepository positionRepo;
    private final QuoteProvider quoteProvider;
    private final OrderPublisher orderPublisher;
    private final EngineEventRepository eventRepo;
    private final AlertService alertService;
    private final BoundedRetry retry;
    private final EngineMetrics metrics;
    private final TrailingStopCalculator calculator;

    public TrailingStopEngine(
            EngineConfig config,
            PositionRepository positionRepo,
            QuoteProvider quoteProvider,
            OrderPublisher orderPublisher,
            EngineEventRepository eventRepo,
            AlertService alertService,
            BoundedRetry retry,
            EngineMetrics metrics) {
        this.positionRepo = positionRepo;
        this.quoteProvider = quoteProvider;
        this.orderPublisher = orderPublisher;
        this.eventRepo = eventRepo;
        this.alertService = alertService;
        this.retry = retry;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
        this.calculator = new TrailingStopCalculator(config.trailingStop());
    }

    @Override
    public MonitorReport tick(InvocationContext ctx) {
        List<Position> open;
        try {
            open = positionRepo.findAllOpen();
        } catch (RuntimeException e) {
            log.error("[TRAILING] Could not load open positions: {}", e.getMessage(), e);
            alertService.sendCriticalAlert("MONITOR_FAILED", null,
                "Open positions could not be loaded; stops are not being checked", Map.of("error", String.valueOf(e.getMessage())));
            return new MonitorReport(0, 0, 0, 0, 0, 1, false);
        }
        metrics.setOpenPositions(open.size());

        Counters c = new Counters();
        boolean timedOut = false;
        for (Position position : open) {
            if (ctx.isExpired()) {
                log.warn("[TRAILING] Deadline reached with {} position(s) unchecked", open.size() - c.checked);
                timedOut = true;
                break;
            }
            c.checked++;
            try {
                monitor(ctx, position, c);
            } catch (RuntimeException e) {
                c.failures++;
                log.error("[TRAILING] {} monitoring failed: {}", position.instrument(), e.getMessage(), e);
                alertService.sendHighAlert("MONITOR_POSITION_FAILED", position.instrument(),
                    "Position check failed: " + e.getMessage(), Map.of("positionId", position.positionId()));
            }
        }

        MonitorReport report = new MonitorReport(c.checked, c.peaks, c.stops, c.exits, c.skipped, c.failures, timedOut);
        log.info("[TRAILING] cycle done: {}", report);
        return report;
    }

    private void monitor(InvocationContext ctx, Position position, Counters c) {
        String instrument = position.instrument();
        CallResult<BigDecimal> quoteResult = retry.call("quote.last", ctx.deadline(),
            () -> quoteProvider.lastPrice(instrument).orElse(null));
        if (!quoteResult.isOk()) {
            c.skipped++;
            log.warn("[TRAILING] {} no quote ({}), skipped this cycle", instrument, quoteResult.message());
            return;
        }
        BigDecimal quote = quoteResult.value();

        Position updated = position.withPeak(quote);
        boolean peakChanged = updated != position;
        BigDecimal newStop = calculator.computeStop(updated);
        Position ratcheted = updated.withStopLoss(newStop);
        boolean stopChanged = ratcheted != updated;

        if (peakChanged || stopChanged) {
            positionRepo.update(ratcheted);
            if (peakChanged) {
                c.peaks++;
                appendEvent(EngineEventType.PEAK_UPDATED, instrument, ctx, Map.of(
                    "positionId", position.positionId(),
                    "previousPeak", position.peakPrice().toPlainString(),
                    "peak", ratcheted.peakPrice().toPlainString()));
            }
            if (stopChanged) {
                c.stops++;
                metrics.recordStopRaised(instrument);
                log.info("[TRAILING] {} stop raised {} -> {} (peak={}, gain={}%)", instrument,
                    position.stopLoss(), ratcheted.stopLoss(), ratcheted.peakPrice(), ratcheted.peakGainPercent());
                appendEvent(EngineEventType.STOP_RAISED, instrument, ctx, Map.of(
                    "positionId", position.positionId(),
                    "previousStop", position.stopLoss().toPlainString(),
                    "stop", ratcheted.stopLoss().toPlainString(),
                    "peakGainPercent", ratcheted.peakGainPercent().toPlainString()));
            }
        }

        ExitReason reason = exitReason(ratcheted, quote);
        if (reason == null) {
            return;
        }

        OrderRequest exit = OrderRequest.forcedExit(instrument, reason, ctx.now());
        CallResult<Boolean> published = retry.call("orders.publish", ctx.deadline(), () -> {
            orderPublisher.publish(exit);
            return Boolean.TRUE;
        });
        if (!published.isOk()) {
            c.failures++;
            log.error("[TRAILING] {} {} exit could not be published: {}", instrument, reason, published.message());
            alertService.sendCriticalAlert("EXIT_PUBLISH_FAILED", instrument,
                reason + " exit could not be published", exitDetails(ratcheted, quote, reason));
            return;
        }
        c.exits++;
        log.warn("[TRAILING] {} {} triggered at {} (stop={}, tp={}), exit {} published", instrument, reason, quote,
            ratcheted.stopLoss(), ratcheted.takeProfit(), exit.requestId());
        alertService.sendMediumAlert("FORCED_EXIT", instrument, reason + " triggered", exitDetails(ratcheted, quote, reason));
    }

    /**
     * Forced exit reason for a quote, or null to keep holding.
     */
    ExitReason exitReason(Position position, BigDecimal quote) {
        if (quote.compareTo(position.stopLoss()) <= 0) {
            return position.stopLoss().compareTo(position.entryPrice()) >= 0
                ? ExitReason.TRAILING_STOP
                : ExitReason.STOP_LOSS;
        }
        if (quote.compareTo(position.takeProfit()) >= 0) {
            return ExitReason.TAKE_PROFIT;
        }
        return null;
    }

    private Map<String, Object> exitDetails(Position position, BigDecimal quote, ExitReason reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.name());
        details.put("quote", quote.toPlainString());
        details.put("entry", position.entryPrice().toPlainString());
        details.put("stopLoss", position.stopLoss().toPlainString());
        details.put("takeProfit", position.takeProfit().toPlainString());
        details.put("peak", position.peakPrice().toPlainString());
        return details;
    }

    private void appendEvent(EngineEventType type, String instrument, InvocationContext ctx, Map<String, Object> payload) {
        try {
            eventRepo.append(new EngineEvent(type, instrument, ctx.now(), payload));
        } catch (RuntimeException e) {
            log.warn("[TRAILING] Failed to record {} event for {}: {}", type, instrument, e.getMessage());
        }
    }

    private static final class Counters {
        int checked;
        int peaks;
        int stops;
        int exits;
        int skipped;
        int failures;
    }
}
