package in.tradefuse.service.sizing;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class KellyCalculatorTest {

    @Test
    void testFullKellyForEvenOddsWithTwoToOnePayoff() {
        BigDecimal kelly = KellyCalculator.fullKelly(new BigDecimal("0.5"), new BigDecimal("2.0"), new BigDecimal("1.0"));

        assertEquals(0, new BigDecimal("0.25").compareTo(kelly), "Expected 0.25, got " + kelly);
    }

    @Test
    void testHalfKelly() {
        KellyCalculator.KellyResult result = KellyCalculator.calculateFull(
            new BigDecimal("0.5"), new BigDecimal("2.0"), new BigDecimal("1.0"), new BigDecimal("0.5"));

        assertEquals(0, new BigDecimal("0.125").compareTo(result.workingKelly()));
        assertEquals(0, new BigDecimal("2").compareTo(result.payoffRatio()));
        assertTrue(result.hasEdge());
        assertTrue(result.getSummary().contains("Kelly=25.00%"), result.getSummary());
    }

    @Test
    void testNegativeEdge() {
        // p=0.3, b=1: (0.3 - 0.7) / 1 = -0.4
        KellyCalculator.KellyResult result = KellyCalculator.calculateFull(
            new BigDecimal("0.3"), new BigDecimal("1.0"), new BigDecimal("1.0"), new BigDecimal("0.5"));

        assertEquals(0, new BigDecimal("-0.4").compareTo(result.fullKelly()));
        assertFalse(result.hasEdge());
    }

    @Test
    void testNoLossesReturnsWinRate() {
        BigDecimal kelly = KellyCalculator.fullKelly(BigDecimal.ONE, new BigDecimal("1.5"), BigDecimal.ZERO);

        assertEquals(0, BigDecimal.ONE.compareTo(kelly));
    }

    @Test
    void testNoWinningPayoffHasNoEdge() {
        BigDecimal kelly = KellyCalculator.fullKelly(new BigDecimal("0.4"), BigDecimal.ZERO, new BigDecimal("1.0"));

        assertTrue(kelly.signum() < 0);
    }
}
