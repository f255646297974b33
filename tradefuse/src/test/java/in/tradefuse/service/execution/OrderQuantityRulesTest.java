package in.tradefuse.service.execution;

import in.tradefuse.config.InstrumentConfig;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderQuantityRulesTest {

    private static final InstrumentConfig XRP = InstrumentConfig.of("xrp", "jpy", "1.0", 6, 0.05, false);
    private static final InstrumentConfig DOGE = InstrumentConfig.of("doge", "jpy", "1.0", 2, 0.07, false);

    @Test
    void testFloorNeverRoundsUp() {
        assertEquals(new BigDecimal("12.99"), OrderQuantityRules.floor(DOGE, new BigDecimal("12.999999")));
    }

    @Test
    void testSellQuantityCappedByFreeBalance() {
        BigDecimal qty = OrderQuantityRules.sellQuantity(XRP, new BigDecimal("150"), new BigDecimal("120.1234567"));

        assertEquals(0, new BigDecimal("120.123456").compareTo(qty));
    }

    @Test
    void testSellQuantityWithoutBalanceIsZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(OrderQuantityRules.sellQuantity(XRP, new BigDecimal("150"), null)));
    }

    @Test
    void testMinimumQuantity() {
        assertTrue(OrderQuantityRules.meetsMinimum(XRP, new BigDecimal("1.0")));
        assertFalse(OrderQuantityRules.meetsMinimum(XRP, new BigDecimal("0.999999")));
        assertFalse(OrderQuantityRules.meetsMinimum(XRP, null));
    }
}
