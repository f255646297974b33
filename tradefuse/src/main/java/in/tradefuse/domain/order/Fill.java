package in.tradefuse.domain.order;

import java.math.BigDecimal;

/**
 * Executed quantity and volume-weighted average price of one order.
 */
public record Fill(
    String orderId,
    BigDecimal quantity,
    BigDecimal averagePrice,
    FillSource source
) {
    public boolean isComplete() {
        return quantity != null && averagePrice != null
            && quantity.signum() > 0 && averagePrice.signum() > 0;
    }

    public Fill withPrice(BigDecimal price, FillSource newSource) {
        return new Fill(orderId, quantity, price, newSource);
    }
}
