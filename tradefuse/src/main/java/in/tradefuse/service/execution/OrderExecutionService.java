package in.tradefuse.service.execution;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.ExecutionTask;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.ExchangeClient;
import in.tradefuse.application.port.output.NotificationChannel;
import in.tradefuse.application.port.output.OrderIntentRepository;
import in.tradefuse.application.port.output.PositionRepository;
import in.tradefuse.application.port.output.TradeBookkeeping;
import in.tradefuse.config.EngineConfig;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.domain.common.CallResult;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.order.BatchResult;
import in.tradefuse.domain.order.ExecutionResult;
import in.tradefuse.domain.order.ExecutionStatus;
import in.tradefuse.domain.order.Fill;
import in.tradefuse.domain.order.IntentStatus;
import in.tradefuse.domain.order.OrderBatch;
import in.tradefuse.domain.order.OrderIntent;
import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.trade.CircuitBreakerState;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.Position;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TradeRecord;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import in.tradefuse.service.risk.CircuitBreaker;
import in.tradefuse.service.sizing.KellyPositionSizer;
import in.tradefuse.service.sizing.SizingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * ✅ Order Execution Service - consumes one batch of order requests.
 *
 * Requests are processed strictly in order. Per request:
 *
 * BUY:
 * 1. Circuit breaker, holding cap and open-position cap (vetoes)
 * 2. Duplicate-holding guard against the exchange balance
 * 3. Kelly sizing
 * 4. Claim the order intent (batch, instrument, action); an existing intent means already handled
 * 5. Place the market order exactly once
 * 6. Bookkeeping: reconcile fill, sanity check, Position + TradeRecord in one atomic write
 *
 * SELL:
 * 1. Veto when this batch already bought the instrument
 * 2. Veto signal exits inside the minimum hold (forced exits bypass)
 * 3. Quantity from position and free balance, floored to the instrument's decimals
 * 4. Claim intent, place once, reconcile, sanity check, closed Position + TradeRecord in one atomic write
 *
 * The real order is always placed before bookkeeping. A bookkeeping failure after a placed
 * order is reported as BOOKKEEPING_FAILED and never retried; the claimed intent blocks
 * a second placement when the batch is replayed.
 */
public final class OrderExecutionService implements ExecutionTask {
    private static final Logger log = LoggerFactory.getLogger(OrderExecutionService.class);

    private final EngineConfig config;
    private final ExchangeClient exchange;
    private final PositionRepository positionRepo;
    private final TradeBookkeeping bookkeeping;
    private final OrderIntentRepository intentRepo;
    private final EngineEventRepository eventRepo;
    private final CircuitBreaker circuitBreaker;
    private final KellyPositionSizer sizer;
    private final FillReconciler fillReconciler;
    private final FillSanityGuard sanityGuard;
    private final BoundedRetry retry;
    private final AlertService alertService;
    private final NotificationChannel notifier;
    private final EngineMetrics metrics;

    public OrderExecutionService(
            EngineConfig config,
            ExchangeClient exchange,
            PositionRepository positionRepo,
            TradeBookkeeping bookkeeping,
            OrderIntentRepository intentRepo,
            EngineEventRepository eventRepo,
            CircuitBreaker circuitBreaker,
            KellyPositionSizer sizer,
            FillReconciler fillReconciler,
            FillSanityGuard sanityGuard,
            BoundedRetry retry,
            AlertService alertService,
            NotificationChannel notifier,
            EngineMetrics metrics) {
        this.config = config;
        this.exchange = exchange;
        this.positionRepo = positionRepo;
        this.bookkeeping = bookkeeping;
        this.intentRepo = intentRepo;
        this.eventRepo = eventRepo;
        this.circuitBreaker = circuitBreaker;
        this.sizer = sizer;
        this.fillReconciler = fillReconciler;
        this.sanityGuard = sanityGuard;
        this.retry = retry;
        this.alertService = alertService;
        this.notifier = notifier;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
    }

    @Override
    public BatchResult consume(InvocationContext ctx, OrderBatch batch) {
        log.info("[EXECUTION] Batch {} with {} request(s), invocation={}", batch.batchId(), batch.requests().size(),
            ctx.invocationId());

        Set<String> boughtInBatch = new HashSet<>();
        List<ExecutionResult> results = new ArrayList<>();

        for (OrderRequest request : batch.requests()) {
            Instant started = ctx.now();
            ExecutionResult result;
            if (ctx.isExpired()) {
                result = ExecutionResult.skipped(request, "deadline reached before processing");
            } else {
                result = processSafely(ctx, batch.batchId(), request, boughtInBatch);
            }
            results.add(result);
            metrics.recordOrder(request.instrument(), request.action(), result.status(),
                Duration.between(started, ctx.now()));
            log.info("[EXECUTION] {} {} -> {} ({})", request.action(), request.instrument(), result.status(), result.detail());
        }

        BatchResult batchResult = new BatchResult(batch.batchId(), results);
        if (batchResult.hasFailures()) {
            log.error("[EXECUTION] Batch {} finished with failures: {}", batch.batchId(), summary(batchResult));
        } else {
            log.info("[EXECUTION] ✅ Batch {} done: {}", batch.batchId(), summary(batchResult));
        }
        return batchResult;
    }

    private ExecutionResult processSafely(InvocationContext ctx, String batchId, OrderRequest request,
                                          Set<String> boughtInBatch) {
        try {
            return request.action() == TradeAction.BUY
                ? processBuy(ctx, batchId, request, boughtInBatch)
                : processSell(ctx, batchId, request, boughtInBatch);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Unexpected failure on {} {}: {}", request.action(), request.instrument(), e.getMessage(), e);
            reportFailure(ctx, request, "Unexpected failure: " + e.getMessage(), null);
            return ExecutionResult.failed(request, "unexpected: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------ BUY

    private ExecutionResult processBuy(InvocationContext ctx, String batchId, OrderRequest request, Set<String> boughtInBatch) {
        String symbol = request.instrument();
        InstrumentConfig instrument = config.requireInstrument(symbol);

        CircuitBreakerState breaker = circuitBreaker.checkBeforeBuy(symbol);
        if (breaker.isTripped()) {
            return veto(ctx, request, "circuit breaker tripped: " + breaker.tripReason(), false);
        }

        if (positionRepo.findOpen(symbol).isPresent()) {
            return veto(ctx, request, "position already open", true);
        }
        int openCount = positionRepo.findAllOpen().size();
        if (openCount >= config.execution().maxOpenPositions()) {
            return veto(ctx, request, "open position cap reached (" + openCount + "/"
                + config.execution().maxOpenPositions() + ")", true);
        }

        CallResult<Balances> balances = retry.call("exchange.balances", ctx.deadline(), exchange::getBalances);
        if (!balances.isOk()) {
            reportFailure(ctx, request, "Balances unavailable: " + balances.message(), null);
            return ExecutionResult.failed(request, "balances unavailable: " + balances.errorKind());
        }
        Balances before = balances.value();

        BigDecimal held = before.free(instrument.baseAsset());
        if (OrderQuantityRules.meetsMinimum(instrument, held)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("heldQuantity", held.toPlainString());
            details.put("minOrderQuantity", instrument.minOrderQuantity().toPlainString());
            alertService.sendMediumAlert("DUPLICATE_BUY_SKIPPED", symbol,
                "Exchange already holds " + instrument.baseAsset() + " without an open position", details);
            return ExecutionResult.skipped(request, "balance already holds " + held + " " + instrument.baseAsset());
        }

        SizingDecision sizing = sizer.size(instrument, request.score(), request.buyThreshold(), before, ctx.now());
        if (sizing.rejected()) {
            return ExecutionResult.skipped(request, "sizing rejected: " + sizing.reason());
        }

        OrderIntent intent = OrderIntent.claim(batchId, request, ctx.now());
        if (!intentRepo.claim(intent)) {
            return alreadyHandled(request, intent.intentKey(), boughtInBatch);
        }

        String orderId;
        try {
            orderId = exchange.placeMarketBuy(symbol, sizing.amount());
        } catch (RuntimeException e) {
            intentRepo.markFailed(intent.intentKey(), e.getMessage());
            log.error("[EXECUTION] BUY {} placement failed: {}", symbol, e.getMessage(), e);
            reportFailure(ctx, request, "BUY placement failed: " + e.getMessage(), Map.of("amount", sizing.amount().toPlainString()));
            return ExecutionResult.failed(request, "placement failed: " + e.getMessage());
        }
        boughtInBatch.add(symbol);
        log.info("[EXECUTION] BUY {} placed: orderId={} amount={} basis={}", symbol, orderId, sizing.amount(), sizing.basis());

        // Order is live from here on: failures are reported, never retried
        try {
            intentRepo.markPlaced(intent.intentKey(), orderId);

            Fill fill = fillReconciler.reconcileBuy(ctx, instrument, orderId, sizing.amount(), before);
            fill = sanityGuard.checkEntry(ctx, symbol, fill);

            Position position = Position.open(UUID.randomUUID().toString(), symbol, fill.averagePrice(),
                fill.quantity(), ctx.now(),
                BigDecimal.valueOf(config.trailingStop().initialStopLossPercent()),
                BigDecimal.valueOf(config.trailingStop().takeProfitPercent()),
                orderId);
            BigDecimal fee = sizing.amount().multiply(BigDecimal.valueOf(config.sizing().takerFeeRate()))
                .setScale(8, RoundingMode.HALF_UP);
            bookkeeping.recordEntry(position, new TradeRecord(symbol, TradeAction.BUY, fill.quantity(),
                fill.averagePrice(), fee, ctx.now(), orderId, batchId, request.score(), request.weights(), fill.source()));

            appendEvent(EngineEventType.POSITION_OPENED, symbol, ctx, Map.of(
                "positionId", position.positionId(),
                "orderId", orderId,
                "entryPrice", position.entryPrice().toPlainString(),
                "quantity", position.quantity().toPlainString(),
                "stopLoss", position.stopLoss().toPlainString(),
                "takeProfit", position.takeProfit().toPlainString()));

            notify("BUY " + symbol, String.format("qty=%s price=%s amount=%s score=%.3f (%s)",
                fill.quantity().toPlainString(), fill.averagePrice().toPlainString(), sizing.amount().toPlainString(),
                request.score(), fill.source()));
            log.info("[EXECUTION] ✅ BUY {} booked: position={} qty={} entry={}", symbol, position.positionId(),
                position.quantity(), position.entryPrice());
            return ExecutionResult.filled(request, fill);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] BUY {} order {} placed but bookkeeping failed: {}", symbol, orderId, e.getMessage(), e);
            reportFailure(ctx, request, "BUY placed but not booked; reconcile manually",
                Map.of("orderId", orderId, "amount", sizing.amount().toPlainString(), "error", String.valueOf(e.getMessage())));
            return ExecutionResult.bookkeepingFailed(request, "order " + orderId + " placed, bookkeeping failed: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------ SELL

    private ExecutionResult processSell(InvocationContext ctx, String batchId, OrderRequest request, Set<String> boughtInBatch) {
        String symbol = request.instrument();
        InstrumentConfig instrument = config.requireInstrument(symbol);

        if (boughtInBatch.contains(symbol)) {
            return veto(ctx, request, "instrument bought earlier in this batch", true);
        }

        Optional<Position> open = positionRepo.findOpen(symbol);
        if (open.isEmpty()) {
            return ExecutionResult.skipped(request, "no open position");
        }
        Position position = open.get();

        if (!request.forced()) {
            Duration held = Duration.between(position.entryTime(), ctx.now());
            Duration minHold = Duration.ofMinutes(config.execution().minHoldMinutes());
            if (held.compareTo(minHold) < 0) {
                return veto(ctx, request, "minimum hold not reached (" + held.toMinutes() + "/" + minHold.toMinutes() + " min)", true);
            }
        }

        CallResult<Balances> balances = retry.call("exchange.balances", ctx.deadline(), exchange::getBalances);
        if (!balances.isOk()) {
            reportFailure(ctx, request, "Balances unavailable: " + balances.message(), null);
            return ExecutionResult.failed(request, "balances unavailable: " + balances.errorKind());
        }
        Balances before = balances.value();

        BigDecimal quantity = OrderQuantityRules.sellQuantity(instrument, position.quantity(), before.free(instrument.baseAsset()));
        if (!OrderQuantityRules.meetsMinimum(instrument, quantity)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("positionQuantity", position.quantity().toPlainString());
            details.put("freeBalance", before.free(instrument.baseAsset()).toPlainString());
            details.put("sellQuantity", quantity.toPlainString());
            details.put("minOrderQuantity", instrument.minOrderQuantity().toPlainString());
            alertService.sendMediumAlert("SELL_BELOW_MINIMUM", symbol, "Sell quantity below exchange minimum", details);
            return ExecutionResult.skipped(request, "sell quantity " + quantity + " below minimum");
        }

        OrderIntent intent = OrderIntent.claim(batchId, request, ctx.now());
        if (!intentRepo.claim(intent)) {
            return alreadyHandled(request, intent.intentKey(), boughtInBatch);
        }

        String orderId;
        try {
            orderId = exchange.placeMarketSell(symbol, quantity);
        } catch (RuntimeException e) {
            intentRepo.markFailed(intent.intentKey(), e.getMessage());
            log.error("[EXECUTION] SELL {} placement failed: {}", symbol, e.getMessage(), e);
            reportFailure(ctx, request, "SELL placement failed: " + e.getMessage(), Map.of("quantity", quantity.toPlainString()));
            return ExecutionResult.failed(request, "placement failed: " + e.getMessage());
        }
        ExitReason reason = request.exitReason() == null ? ExitReason.SIGNAL : request.exitReason();
        log.info("[EXECUTION] SELL {} placed: orderId={} qty={} reason={}", symbol, orderId, quantity, reason);

        try {
            intentRepo.markPlaced(intent.intentKey(), orderId);

            Fill fill = fillReconciler.reconcileSell(ctx, instrument, orderId, quantity, before);
            fill = sanityGuard.checkExit(ctx, symbol, fill);

            Position closed = position.close(fill.averagePrice(), ctx.now(), reason, orderId);
            BigDecimal fee = fill.averagePrice().multiply(fill.quantity())
                .multiply(BigDecimal.valueOf(config.sizing().takerFeeRate()))
                .setScale(8, RoundingMode.HALF_UP);
            bookkeeping.recordExit(closed, new TradeRecord(symbol, TradeAction.SELL, fill.quantity(),
                fill.averagePrice(), fee, ctx.now(), orderId, batchId, request.score(), request.weights(), fill.source()));

            appendEvent(EngineEventType.POSITION_CLOSED, symbol, ctx, Map.of(
                "positionId", closed.positionId(),
                "orderId", orderId,
                "reason", reason.name(),
                "entryPrice", closed.entryPrice().toPlainString(),
                "exitPrice", closed.exitPrice().toPlainString(),
                "realizedPnl", closed.realizedPnl().toPlainString()));

            notify("SELL " + symbol, String.format("qty=%s price=%s reason=%s pnl=%s (%s)",
                fill.quantity().toPlainString(), fill.averagePrice().toPlainString(), reason,
                closed.realizedPnl().setScale(0, RoundingMode.HALF_UP).toPlainString(), fill.source()));
            log.info("[EXECUTION] ✅ SELL {} booked: position={} exit={} pnl={}", symbol, closed.positionId(),
                closed.exitPrice(), closed.realizedPnl());
            return ExecutionResult.filled(request, fill);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] SELL {} order {} placed but bookkeeping failed: {}", symbol, orderId, e.getMessage(), e);
            reportFailure(ctx, request, "SELL placed but not booked; reconcile manually",
                Map.of("orderId", orderId, "quantity", quantity.toPlainString(), "error", String.valueOf(e.getMessage())));
            return ExecutionResult.bookkeepingFailed(request, "order " + orderId + " placed, bookkeeping failed: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------ helpers

    private ExecutionResult alreadyHandled(OrderRequest request, String intentKey, Set<String> boughtInBatch) {
        Optional<OrderIntent> existing = intentRepo.find(intentKey);
        IntentStatus status = existing.map(OrderIntent::status).orElse(IntentStatus.CLAIMED);
        if (request.action() == TradeAction.BUY && status == IntentStatus.PLACED) {
            boughtInBatch.add(request.instrument());
        }
        log.warn("[EXECUTION] Intent {} already exists with status {}; not placing again", intentKey, status);
        return ExecutionResult.skipped(request, "intent " + intentKey + " already " + status);
    }

    private ExecutionResult veto(InvocationContext ctx, OrderRequest request, String reason, boolean alert) {
        log.warn("[EXECUTION] ⛔ {} {} vetoed: {}", request.action(), request.instrument(), reason);
        metrics.recordVeto(request.instrument(), reason);
        appendEvent(EngineEventType.ORDER_VETOED, request.instrument(), ctx, Map.of(
            "action", request.action().name(),
            "requestId", request.requestId(),
            "reason", reason));
        // Breaker trips raise their own alert
        if (alert) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("action", request.action().name());
            details.put("score", request.score());
            details.put("reason", reason);
            alertService.sendMediumAlert("ORDER_VETOED", request.instrument(), request.action() + " vetoed: " + reason, details);
        }
        return ExecutionResult.vetoed(request, reason);
    }

    private void reportFailure(InvocationContext ctx, OrderRequest request, String message, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", request.action().name());
        details.put("requestId", request.requestId());
        details.put("score", request.score());
        if (extra != null) {
            details.putAll(extra);
        }
        alertService.sendCriticalAlert("EXECUTION_FAILURE", request.instrument(), message, details);
        appendEvent(EngineEventType.EXECUTION_FAILURE, request.instrument(), ctx, details);
    }

    private void appendEvent(EngineEventType type, String instrument, InvocationContext ctx, Map<String, Object> payload) {
        try {
            eventRepo.append(new EngineEvent(type, instrument, ctx.now(), payload));
        } catch (RuntimeException e) {
            log.warn("[EXECUTION] Failed to record {} event for {}: {}", type, instrument, e.getMessage());
        }
    }

    private void notify(String title, String message) {
        if (notifier == null) {
            return;
        }
        try {
            notifier.send(title, message);
        } catch (RuntimeException e) {
            log.warn("[EXECUTION] Notification failed: {}", e.getMessage());
        }
    }

    private static String summary(BatchResult result) {
        return String.format("filled=%d skipped=%d vetoed=%d failed=%d bookkeepingFailed=%d",
            result.count(ExecutionStatus.FILLED),
            result.count(ExecutionStatus.SKIPPED),
            result.count(ExecutionStatus.VETOED),
            result.count(ExecutionStatus.FAILED),
            result.count(ExecutionStatus.BOOKKEEPING_FAILED));
    }
}
