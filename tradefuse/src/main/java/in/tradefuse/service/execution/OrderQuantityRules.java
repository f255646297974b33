package in.tradefuse.service.execution;

import in.tradefuse.config.InstrumentConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exchange quantity rules per instrument: decimals and minimum order size.
 */
public final class OrderQuantityRules {

    /**
     * Floor a quantity to the instrument's decimals.
     */
    public static BigDecimal floor(InstrumentConfig instrument, BigDecimal quantity) {
        return quantity.setScale(instrument.quantityScale(), RoundingMode.DOWN);
    }

    /**
     * Sellable quantity: the position size capped at the free balance, floored to the decimals.
     */
    public static BigDecimal sellQuantity(InstrumentConfig instrument, BigDecimal positionQuantity, BigDecimal freeBalance) {
        BigDecimal free = freeBalance == null ? BigDecimal.ZERO : freeBalance;
        return floor(instrument, positionQuantity.min(free)).max(BigDecimal.ZERO);
    }

    public static boolean meetsMinimum(InstrumentConfig instrument, BigDecimal quantity) {
        return quantity != null && quantity.compareTo(instrument.minOrderQuantity()) >= 0;
    }

    private OrderQuantityRules() {}
}
