package in.tradefuse.service.execution;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.output.ExchangeClient;
import in.tradefuse.application.port.output.QuoteProvider;
import in.tradefuse.config.ExecutionConfig;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.order.Fill;
import in.tradefuse.domain.order.FillSource;
import in.tradefuse.infrastructure.retry.RetryPolicy;
import in.tradefuse.infrastructure.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves quantity and average price of a placed order.
 *
 * 1. Poll the exchange's execution history with bounded exponential backoff
 * 2. Fall back to the balance change around the order
 * 3. SELL only: fall back to the live quote for the price
 *
 * Never invents a BUY fill: when neither source yields one the BUY cannot be booked and an
 * exception is thrown.
 */
public final class FillReconciler {
    private static final Logger log = LoggerFactory.getLogger(FillReconciler.class);

    private static final int PRICE_SCALE = 8;

    private final ExecutionConfig config;
    private final ExchangeClient exchange;
    private final QuoteProvider quoteProvider;
    private final Sleeper sleeper;
    private final AlertService alertService;

    public FillReconciler(ExecutionConfig config, ExchangeClient exchange, QuoteProvider quoteProvider,
                          Sleeper sleeper, AlertService alertService) {
        this.config = config;
        this.exchange = exchange;
        this.quoteProvider = quoteProvider;
        this.sleeper = sleeper;
        this.alertService = alertService;
    }

    /**
     * @param quoteAmount Quote currency sent with the market BUY
     * @param before      Balances read before the order was placed
     */
    public Fill reconcileBuy(InvocationContext ctx, InstrumentConfig instrument, String orderId,
                             BigDecimal quoteAmount, Balances before) {
        Optional<Fill> polled = poll(ctx, instrument.symbol(), orderId);
        if (polled.isPresent()) {
            return polled.get();
        }

        Optional<Balances> after = balancesAfter(instrument.symbol());
        if (after.isPresent()) {
            BigDecimal bought = after.get().free(instrument.baseAsset()).subtract(before.free(instrument.baseAsset()));
            if (bought.signum() > 0) {
                BigDecimal price = quoteAmount.divide(bought, PRICE_SCALE, RoundingMode.HALF_UP);
                Fill estimate = new Fill(orderId, bought, price, FillSource.BALANCE_ESTIMATE);
                fallbackAlert(instrument.symbol(), orderId, "BUY", estimate);
                return estimate;
            }
        }

        throw new IllegalStateException("No fill could be reconciled for BUY order " + orderId
            + " on " + instrument.symbol());
    }

    /**
     * @param quantity Quantity sent with the market SELL
     * @param before   Balances read before the order was placed
     */
    public Fill reconcileSell(InvocationContext ctx, InstrumentConfig instrument, String orderId,
                              BigDecimal quantity, Balances before) {
        Optional<Fill> polled = poll(ctx, instrument.symbol(), orderId);
        if (polled.isPresent()) {
            return polled.get();
        }

        Optional<Balances> after = balancesAfter(instrument.symbol());
        if (after.isPresent()) {
            BigDecimal proceeds = after.get().free(instrument.quoteAsset()).subtract(before.free(instrument.quoteAsset()));
            if (proceeds.signum() > 0 && quantity.signum() > 0) {
                BigDecimal price = proceeds.divide(quantity, PRICE_SCALE, RoundingMode.HALF_UP);
                Fill estimate = new Fill(orderId, quantity, price, FillSource.BALANCE_ESTIMATE);
                fallbackAlert(instrument.symbol(), orderId, "SELL", estimate);
                return estimate;
            }
        }

        Optional<BigDecimal> quote = lastPrice(instrument.symbol());
        if (quote.isPresent()) {
            Fill estimate = new Fill(orderId, quantity, quote.get(), FillSource.LIVE_QUOTE);
            fallbackAlert(instrument.symbol(), orderId, "SELL", estimate);
            return estimate;
        }

        throw new IllegalStateException("No fill or live quote for SELL order " + orderId
            + " on " + instrument.symbol());
    }

    private Optional<Fill> poll(InvocationContext ctx, String instrument, String orderId) {
        RetryPolicy policy = RetryPolicy.forFillPolling(config);
        while (policy.shouldRetry()) {
            try {
                Optional<Fill> fill = exchange.getFill(instrument, orderId);
                if (fill.isPresent() && fill.get().isComplete()) {
                    log.info("[FILL] {} order {} filled qty={} avg={} after {} poll(s)", instrument, orderId,
                        fill.get().quantity(), fill.get().averagePrice(), policy.getFailureCount() + 1);
                    return fill;
                }
            } catch (RuntimeException e) {
                log.warn("[FILL] {} order {} fill lookup failed: {}", instrument, orderId, e.getMessage());
            }

            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            Duration delay = policy.getNextDelay();
            if (ctx.now().plus(delay).isAfter(ctx.deadline())) {
                log.warn("[FILL] {} order {} polling stopped at the invocation deadline", instrument, orderId);
                break;
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[FILL] {} order {} polling interrupted", instrument, orderId);
                break;
            }
        }
        log.warn("[FILL] {} order {} not reported after {} poll(s), falling back", instrument, orderId,
            policy.getFailureCount());
        return Optional.empty();
    }

    private Optional<Balances> balancesAfter(String instrument) {
        try {
            return Optional.ofNullable(exchange.getBalances());
        } catch (RuntimeException e) {
            log.warn("[FILL] {} balances unavailable for fill estimate: {}", instrument, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> lastPrice(String instrument) {
        try {
            return quoteProvider.lastPrice(instrument).filter(p -> p.signum() > 0);
        } catch (RuntimeException e) {
            log.warn("[FILL] {} live quote unavailable: {}", instrument, e.getMessage());
            return Optional.empty();
        }
    }

    private void fallbackAlert(String instrument, String orderId, String side, Fill estimate) {
        log.warn("[FILL] {} {} order {} booked from {}: qty={} price={}", instrument, side, orderId,
            estimate.source(), estimate.quantity(), estimate.averagePrice());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", orderId);
        details.put("side", side);
        details.put("source", estimate.source().name());
        details.put("quantity", estimate.quantity().toPlainString());
        details.put("price", estimate.averagePrice().toPlainString());
        alertService.sendMediumAlert("FILL_ESTIMATED", instrument,
            side + " fill not reported by the exchange; booked from " + estimate.source(), details);
    }
}
