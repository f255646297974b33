package in.tradefuse.domain.order;

import in.tradefuse.domain.trade.TradeAction;

import java.time.Instant;

/**
 * Idempotency record for one order placement.
 *
 * The key is derived from (batch, instrument, action), so replaying a batch finds the
 * existing intent instead of placing a second order.
 */
public record OrderIntent(
    String intentKey,
    String batchId,
    String requestId,
    String instrument,
    TradeAction action,
    IntentStatus status,
    String orderId,
    String detail,
    Instant createdAt
) {
    public static String keyFor(String batchId, String instrument, TradeAction action) {
        return batchId + ":" + instrument + ":" + action.name();
    }

    public static OrderIntent claim(String batchId, OrderRequest request, Instant now) {
        return new OrderIntent(keyFor(batchId, request.instrument(), request.action()), batchId,
            request.requestId(), request.instrument(), request.action(), IntentStatus.CLAIMED, null, null, now);
    }
}
