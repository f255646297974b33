package in.tradefuse.service.execution;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.QuoteProvider;
import in.tradefuse.config.ExecutionConfig;
import in.tradefuse.domain.common.CallResult;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.order.Fill;
import in.tradefuse.domain.order.FillSource;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compares a fill price with an independent live quote before it is trusted.
 *
 * A deviation above the entry (or exit) threshold marks the fill price as corrupt: the live
 * quote is used instead and an alert is raised. Without a quote the fill is kept as is.
 */
public final class FillSanityGuard {
    private static final Logger log = LoggerFactory.getLogger(FillSanityGuard.class);

    private final ExecutionConfig config;
    private final QuoteProvider quoteProvider;
    private final BoundedRetry retry;
    private final AlertService alertService;
    private final EngineEventRepository eventRepo;
    private final EngineMetrics metrics;

    public FillSanityGuard(ExecutionConfig config, QuoteProvider quoteProvider, BoundedRetry retry,
                           AlertService alertService, EngineEventRepository eventRepo, EngineMetrics metrics) {
        this.config = config;
        this.quoteProvider = quoteProvider;
        this.retry = retry;
        this.alertService = alertService;
        this.eventRepo = eventRepo;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
    }

    public Fill checkEntry(InvocationContext ctx, String instrument, Fill fill) {
        return check(ctx, instrument, fill, config.entrySanityThreshold(), "entry");
    }

    public Fill checkExit(InvocationContext ctx, String instrument, Fill fill) {
        return check(ctx, instrument, fill, config.exitSanityThreshold(), "exit");
    }

    private Fill check(InvocationContext ctx, String instrument, Fill fill, double threshold, String side) {
        // A fill already priced from the live quote has nothing to compare against
        if (fill.source() == FillSource.LIVE_QUOTE) {
            return fill;
        }
        CallResult<BigDecimal> quote = retry.call("quote.last", ctx.deadline(),
            () -> quoteProvider.lastPrice(instrument).orElse(null));
        if (!quote.isOk() || quote.value().signum() <= 0) {
            log.warn("[SANITY] {} no live quote for {} check ({}); trusting fill price {}",
                instrument, side, quote.message(), fill.averagePrice());
            return fill;
        }

        BigDecimal live = quote.value();
        double deviation = deviation(fill.averagePrice(), live);
        if (deviation <= threshold) {
            log.debug("[SANITY] {} {} fill {} within {} of quote {}", instrument, side, fill.averagePrice(), threshold, live);
            return fill;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("side", side);
        details.put("orderId", fill.orderId());
        details.put("fillPrice", fill.averagePrice().toPlainString());
        details.put("fillSource", fill.source().name());
        details.put("liveQuote", live.toPlainString());
        details.put("deviation", String.format("%.4f", deviation));
        details.put("threshold", threshold);

        log.error("[SANITY] {} {} fill price {} deviates {} from live quote {}; using the quote",
            instrument, side, fill.averagePrice(), String.format("%.2f%%", deviation * 100), live);
        metrics.recordFillAnomaly(instrument, side);
        alertService.sendHighAlert("FILL_PRICE_ANOMALY", instrument,
            "Implausible " + side + " fill price replaced by live quote", details);
        try {
            eventRepo.append(new EngineEvent(EngineEventType.FILL_ANOMALY, instrument, ctx.now(), details));
        } catch (RuntimeException e) {
            log.warn("[SANITY] Failed to record fill anomaly event for {}: {}", instrument, e.getMessage());
        }
        return fill.withPrice(live, FillSource.LIVE_QUOTE);
    }

    static double deviation(BigDecimal price, BigDecimal reference) {
        if (price == null || price.signum() <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return price.subtract(reference).abs().divide(reference, 8, RoundingMode.HALF_UP).doubleValue();
    }
}
