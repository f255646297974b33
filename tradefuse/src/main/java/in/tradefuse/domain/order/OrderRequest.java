package in.tradefuse.domain.order;

import in.tradefuse.domain.signal.ComponentWeights;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.TradeAction;

import java.time.Instant;
import java.util.UUID;

/**
 * Order request handed from scoring or monitoring to execution.
 *
 * forced marks hard stop-loss/take-profit exits, which bypass the minimum-hold veto.
 * buyThreshold is the calibrated BUY threshold at decision time (NaN for exits).
 */
public record OrderRequest(
    String requestId,
    String instrument,
    TradeAction action,
    double score,
    double buyThreshold,
    ExitReason exitReason,
    boolean forced,
    ComponentWeights weights,
    Instant createdAt
) {
    public static OrderRequest buy(String instrument, double score, double buyThreshold,
                                   ComponentWeights weights, Instant createdAt) {
        return new OrderRequest(UUID.randomUUID().toString(), instrument, TradeAction.BUY,
            score, buyThreshold, null, false, weights, createdAt);
    }

    public static OrderRequest signalSell(String instrument, double score, ComponentWeights weights, Instant createdAt) {
        return new OrderRequest(UUID.randomUUID().toString(), instrument, TradeAction.SELL,
            score, Double.NaN, ExitReason.SIGNAL, false, weights, createdAt);
    }

    public static OrderRequest forcedExit(String instrument, ExitReason reason, Instant createdAt) {
        return new OrderRequest(UUID.randomUUID().toString(), instrument, TradeAction.SELL,
            -1.0, Double.NaN, reason, reason.isForced(), null, createdAt);
    }
}
