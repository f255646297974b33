package in.tradefuse.domain.trade;

import in.tradefuse.domain.order.FillSource;
import in.tradefuse.domain.signal.ComponentWeights;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of one fill.
 *
 * fee is in quote currency. weights are the component weights of the decision that
 * originated the order; null for forced exits.
 */
public record TradeRecord(
    String instrument,
    TradeAction action,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal fee,
    Instant timestamp,
    String orderId,
    String batchId,
    double score,
    ComponentWeights weights,
    FillSource fillSource
) {
    public BigDecimal notional() {
        return price.multiply(quantity);
    }
}
