package in.tradefuse.service.signal;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.input.ScoringTask;
import in.tradefuse.application.port.output.CandleFeed;
import in.tradefuse.application.port.output.ForecastModel;
import in.tradefuse.application.port.output.MacroContextService;
import in.tradefuse.application.port.output.OrderPublisher;
import in.tradefuse.application.port.output.SentimentService;
import in.tradefuse.application.port.output.SignalRepository;
import in.tradefuse.application.port.output.TechnicalIndicatorService;
import in.tradefuse.config.EngineConfig;
import in.tradefuse.config.FusionConfig;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.domain.common.CallResult;
import in.tradefuse.domain.data.Candle;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.ComponentWeights;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.ForecastPrediction;
import in.tradefuse.domain.signal.ForecastResult;
import in.tradefuse.domain.signal.FusionResult;
import in.tradefuse.domain.signal.InstrumentDecision;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.NormalizedComponents;
import in.tradefuse.domain.signal.SentimentResult;
import in.tradefuse.domain.signal.Signal;
import in.tradefuse.domain.signal.TechnicalResult;
import in.tradefuse.domain.signal.ThresholdSet;
import in.tradefuse.domain.signal.TimeframeScore;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import in.tradefuse.service.mtf.MultiTimeframeAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring tick for one instrument.
 *
 * 1. Fetch macro context and sentiment once
 * 2. Per timeframe: technical result, candles and a forecast; normalize, fuse, persist a Signal
 * 3. Calibrate thresholds from the reference timeframe's band width
 * 4. Aggregate timeframes, classify, persist the decision
 * 5. Publish an order request for BUY or SELL
 *
 * Every upstream read goes through the bounded retry boundary; a failed read becomes a
 * missing component. A failed Signal or decision write fails the tick and no order is published.
 */
public final class ScoringService implements ScoringTask {
    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final EngineConfig config;
    private final MacroContextService macroService;
    private final SentimentService sentimentService;
    private final TechnicalIndicatorService technicalService;
    private final CandleFeed candleFeed;
    private final ForecastModel forecastModel;
    private final SignalRepository signalRepo;
    private final OrderPublisher orderPublisher;
    private final BoundedRetry retry;
    private final EngineMetrics metrics;
    private final AlertService alertService;

    private final ScoreNormalizer normalizer;
    private final ConfidenceWeightedFuser fuser;
    private final ForecastScorer forecastScorer;
    private final ThresholdCalibrator calibrator;
    private final DecisionStateMachine stateMachine;
    private final MultiTimeframeAggregator aggregator;

    public ScoringService(
            EngineConfig config,
            MacroContextService macroService,
            SentimentService sentimentService,
            TechnicalIndicatorService technicalService,
            CandleFeed candleFeed,
            ForecastModel forecastModel,
            SignalRepository signalRepo,
            OrderPublisher orderPublisher,
            BoundedRetry retry,
            EngineMetrics metrics,
            AlertService alertService) {
        this.config = config;
        this.macroService = macroService;
        this.sentimentService = sentimentService;
        this.technicalService = technicalService;
        this.candleFeed = candleFeed;
        this.forecastModel = forecastModel;
        this.signalRepo = signalRepo;
        this.orderPublisher = orderPublisher;
        this.retry = retry;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
        this.alertService = alertService;

        this.normalizer = new ScoreNormalizer(config.fusion());
        this.fuser = new ConfidenceWeightedFuser(config.fusion());
        this.forecastScorer = new ForecastScorer(config.fusion());
        this.calibrator = new ThresholdCalibrator(config.thresholds());
        this.stateMachine = new DecisionStateMachine();
        this.aggregator = new MultiTimeframeAggregator(config.timeframes());
    }

    @Override
    public ScoringOutcome tick(InvocationContext ctx, String instrument) {
        InstrumentConfig instrumentConfig = config.requireInstrument(instrument);
        Instant now = ctx.now();
        log.info("[SCORING] {} tick start invocation={}", instrument, ctx.invocationId());

        MacroResult macro = fetchMacro(ctx, now);
        SentimentResult sentiment = retry.call("sentiment.latest", ctx.deadline(),
                () -> sentimentService.latest(instrument))
            .orElse(SentimentResult.missing(instrument));

        // Gather all timeframe inputs first: thresholds depend on the reference timeframe
        Map<Timeframe, TechnicalResult> technicals = new EnumMap<>(Timeframe.class);
        Map<Timeframe, ForecastResult> forecasts = new EnumMap<>(Timeframe.class);
        Map<Timeframe, Instant> lastCandleTimes = new EnumMap<>(Timeframe.class);
        BigDecimal referencePrice = null;

        for (Timeframe tf : activeTimeframes()) {
            if (ctx.isExpired()) {
                log.warn("[SCORING] {} deadline reached while fetching {}", instrument, tf);
                return ScoringOutcome.timedOut(instrument, 0);
            }
            technicals.put(tf, fetchTechnical(ctx, instrument, tf, now));

            List<Candle> candles = fetchCandles(ctx, instrument, tf, now);
            if (!candles.isEmpty()) {
                Candle last = candles.get(candles.size() - 1);
                lastCandleTimes.put(tf, last.timestamp());
                if (tf == config.timeframes().referenceTimeframe() || referencePrice == null) {
                    referencePrice = last.close();
                }
            }
            forecasts.put(tf, forecastFor(ctx, instrument, tf, candles));
        }

        TechnicalResult referenceTechnical = technicals.get(config.timeframes().referenceTimeframe());
        double bandWidth = referenceTechnical != null && referenceTechnical.isUsable() ? referenceTechnical.bandWidth() : 0.0;
        ThresholdSet thresholds = calibrator.calibrate(instrument, bandWidth, instrumentConfig.baselineBandWidth(), macro);

        Map<Timeframe, TimeframeScore> timeframeScores = new EnumMap<>(Timeframe.class);
        ComponentWeights referenceWeights = null;
        int written = 0;

        for (Timeframe tf : technicals.keySet()) {
            TechnicalResult technical = technicals.get(tf);
            ForecastResult forecast = forecasts.get(tf);

            NormalizedComponents components = normalizer.normalize(technical, forecast, sentiment, macro);
            FusionResult fusion = fuser.fuse(components, instrumentConfig.reference(), macro.dominanceTrend());
            Decision tfDecision = stateMachine.decide(fusion.score(), thresholds);
            Signal signal = Signal.of(instrument, tf, now, fusion, thresholds, tfDecision);

            try {
                signalRepo.save(signal);
                written++;
            } catch (RuntimeException e) {
                log.error("[SCORING] {} failed to persist {} signal: {}", instrument, tf, e.getMessage(), e);
                alert("SIGNAL_WRITE_FAILED", instrument, "Signal write failed for " + tf + ": " + e.getMessage());
                return ScoringOutcome.failed(instrument, null, written, "signal write failed: " + tf);
            }

            if (tf == config.timeframes().referenceTimeframe() || referenceWeights == null) {
                referenceWeights = fusion.weights();
            }

            if (!technical.isUsable() && !forecast.isUsable()) {
                timeframeScores.put(tf, TimeframeScore.unavailable(tf));
                continue;
            }
            Instant observedAt = technical.isUsable() ? technical.observedAt() : lastCandleTimes.get(tf);
            timeframeScores.put(tf, TimeframeScore.of(tf, fusion.score(), observedAt));

            log.debug("[SCORING] {} {} fused={} (t={} f={} s={} m={}) lowConfidence={}",
                instrument, tf, fmt(fusion.score()), fmt(components.technical()), fmt(components.forecast()),
                fmt(components.sentiment()), fmt(components.macro()), fusion.isLowConfidence());
        }

        AggregatedScore aggregate = aggregator.aggregate(instrument, timeframeScores, now);
        Decision decision = stateMachine.decide(aggregate, thresholds);
        InstrumentDecision instrumentDecision = new InstrumentDecision(instrument, now, aggregate, thresholds,
            decision, referencePrice);

        try {
            signalRepo.saveDecision(instrumentDecision);
        } catch (RuntimeException e) {
            log.error("[SCORING] {} failed to persist decision: {}", instrument, e.getMessage(), e);
            alert("DECISION_WRITE_FAILED", instrument, "Decision write failed: " + e.getMessage());
            return ScoringOutcome.failed(instrument, instrumentDecision, written, "decision write failed");
        }
        metrics.recordDecision(instrument, decision);

        log.info("[SCORING] {} score={} buy={} sell={} agreement={} adjustment={} -> {}",
            instrument, fmt(aggregate.score()), fmt(thresholds.buyThreshold()), fmt(thresholds.sellThreshold()),
            fmt(aggregate.agreementRatio()), aggregate.adjustment(), decision);

        if (!decision.isActionable()) {
            return ScoringOutcome.ok(instrumentDecision, null, written);
        }
        if (ctx.isExpired()) {
            log.warn("[SCORING] {} deadline reached before publishing {}", instrument, decision);
            return ScoringOutcome.timedOut(instrument, written);
        }

        OrderRequest request = decision == Decision.BUY
            ? OrderRequest.buy(instrument, aggregate.score(), thresholds.buyThreshold(), referenceWeights, now)
            : OrderRequest.signalSell(instrument, aggregate.score(), referenceWeights, now);

        CallResult<Boolean> published = retry.call("orders.publish", ctx.deadline(), () -> {
            orderPublisher.publish(request);
            return Boolean.TRUE;
        });
        if (!published.isOk()) {
            log.error("[SCORING] {} failed to publish {} request: {}", instrument, decision, published.message());
            alert("ORDER_PUBLISH_FAILED", instrument, "Could not publish " + decision + ": " + published.message());
            return ScoringOutcome.failed(instrument, instrumentDecision, written, "publish failed");
        }

        log.info("[SCORING] ✅ {} {} request {} published", instrument, decision, request.requestId());
        return ScoringOutcome.ok(instrumentDecision, request, written);
    }

    private List<Timeframe> activeTimeframes() {
        List<Timeframe> active = new ArrayList<>();
        for (Timeframe tf : Timeframe.values()) {
            if (config.timeframes().weight(tf) > 0) {
                active.add(tf);
            }
        }
        return active;
    }

    private MacroResult fetchMacro(InvocationContext ctx, Instant now) {
        MacroResult macro = retry.call("macro.latest", ctx.deadline(), macroService::latest)
            .orElse(MacroResult.missing());
        if (macro.isUsable() && isOlderThan(macro.observedAt(), now,
                Duration.ofMinutes(config.fusion().macroFreshnessMinutes()))) {
            log.warn("[SCORING] macro context stale (observedAt={})", macro.observedAt());
            return macro.asStale();
        }
        return macro;
    }

    private TechnicalResult fetchTechnical(InvocationContext ctx, String instrument, Timeframe tf, Instant now) {
        TechnicalResult technical = retry.call("technical.latest", ctx.deadline(),
                () -> technicalService.latest(instrument, tf))
            .orElse(TechnicalResult.missing(instrument, tf));
        if (technical.isUsable() && isOlderThan(technical.observedAt(), now, config.timeframes().staleAfter(tf))) {
            log.warn("[SCORING] {} {} technical result stale (observedAt={})", instrument, tf, technical.observedAt());
            return technical.asStale();
        }
        return technical;
    }

    private List<Candle> fetchCandles(InvocationContext ctx, String instrument, Timeframe tf, Instant now) {
        Instant from = now.minus(Duration.ofMinutes(tf.minutesFor(config.fusion().historyCandles())));
        return retry.call("candles." + tf.name(), ctx.deadline(), () -> candleFeed.candles(instrument, tf, from, now))
            .orElse(List.of());
    }

    private ForecastResult forecastFor(InvocationContext ctx, String instrument, Timeframe tf, List<Candle> candles) {
        FusionConfig fusion = config.fusion();
        if (candles.size() < fusion.minForecastHistory()) {
            log.debug("[SCORING] {} {} only {} candles, forecast skipped", instrument, tf, candles.size());
            return ForecastResult.missing(instrument, tf);
        }
        List<BigDecimal> closes = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            closes.add(c.close());
        }
        Candle last = candles.get(candles.size() - 1);
        CallResult<ForecastPrediction> prediction = retry.call("forecast.predict", ctx.deadline(),
            () -> forecastModel.predict(instrument, closes, fusion.forecastHorizon()));
        if (!prediction.isOk()) {
            return ForecastResult.missing(instrument, tf);
        }
        return forecastScorer.score(instrument, tf, prediction.value(), last.close(), last.timestamp());
    }

    private static boolean isOlderThan(Instant observedAt, Instant now, Duration bound) {
        return observedAt == null || Duration.between(observedAt, now).compareTo(bound) > 0;
    }

    private void alert(String type, String instrument, String message) {
        if (alertService != null) {
            alertService.sendHighAlert(type, instrument, message, Map.of());
        }
    }

    private static String fmt(double value) {
        return String.format("%.4f", value);
    }
}
