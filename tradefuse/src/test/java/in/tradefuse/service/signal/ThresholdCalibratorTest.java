package in.tradefuse.service.signal;

import in.tradefuse.config.ThresholdConfig;
import in.tradefuse.domain.signal.DominanceTrend;
import in.tradefuse.domain.signal.MacroRegime;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.ThresholdSet;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdCalibratorTest {

    private static final String ETH = "eth_jpy";
    private static final double BASELINE = 0.04;
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ThresholdCalibrator calibrator = new ThresholdCalibrator(ThresholdConfig.defaults());

    @Test
    void testBaselineVolatilityKeepsBaseThresholds() {
        ThresholdSet t = calibrator.calibrate(ETH, BASELINE, BASELINE, neutral());

        assertEquals(0.25, t.buyThreshold(), 1e-9);
        assertEquals(-0.20, t.sellThreshold(), 1e-9);
        assertEquals(1.0, t.volatilityRatio(), 1e-9);
        assertFalse(t.macroAdjusted());
    }

    @Test
    void testHighVolatilityWidensBothThresholds() {
        ThresholdSet t = calibrator.calibrate(ETH, 0.06, BASELINE, neutral());

        assertEquals(1.5, t.volatilityRatio(), 1e-9);
        assertEquals(0.375, t.buyThreshold(), 1e-9);
        assertEquals(-0.30, t.sellThreshold(), 1e-9);
    }

    @Test
    void testRatioIsClamped() {
        assertEquals(2.0, calibrator.volatilityRatio(0.40, BASELINE), 1e-9);
        assertEquals(0.67, calibrator.volatilityRatio(0.001, BASELINE), 1e-9);
    }

    @Test
    void testUnknownBandWidthUsesNeutralRatio() {
        assertEquals(1.0, calibrator.volatilityRatio(0.0, BASELINE));
        assertEquals(1.0, calibrator.volatilityRatio(Double.NaN, BASELINE));
        assertEquals(1.0, calibrator.volatilityRatio(0.05, 0.0));
    }

    @Test
    void testExtremeMacroRaisesBuyOnly() {
        MacroResult fear = MacroResult.present(-0.8, MacroRegime.EXTREME_FEAR, DominanceTrend.FLAT, List.of(), NOW);

        ThresholdSet t = calibrator.calibrate(ETH, BASELINE, BASELINE, fear);

        assertTrue(t.macroAdjusted());
        assertEquals(0.30, t.buyThreshold(), 1e-9);
        assertEquals(-0.20, t.sellThreshold(), 1e-9, "SELL threshold is never macro-adjusted");
    }

    @Test
    void testBuyThresholdNeverExceedsCeiling() {
        MacroResult greed = MacroResult.present(0.9, MacroRegime.EXTREME_GREED, DominanceTrend.FLAT, List.of(), NOW);

        ThresholdSet t = calibrator.calibrate(ETH, 1.0, BASELINE, greed);

        assertEquals(0.50, t.buyThreshold(), 1e-9);
        assertEquals(-0.40, t.sellThreshold(), 1e-9);
    }

    @Test
    void testStaleExtremeMacroIsIgnored() {
        MacroResult stale = MacroResult.present(-0.8, MacroRegime.EXTREME_FEAR, DominanceTrend.FLAT, List.of(), NOW)
            .asStale();

        ThresholdSet t = calibrator.calibrate(ETH, BASELINE, BASELINE, stale);

        assertFalse(t.macroAdjusted());
        assertEquals(0.25, t.buyThreshold(), 1e-9);
    }

    @Test
    void testThresholdsMonotonicInVolatility() {
        double previousBuy = -1.0;
        double previousSell = 1.0;
        for (int i = 1; i <= 100; i++) {
            double bandWidth = i * 0.002;
            ThresholdSet t = calibrator.calibrate(ETH, bandWidth, BASELINE, neutral());

            assertTrue(t.buyThreshold() >= previousBuy, "BUY must not fall as volatility rises");
            assertTrue(t.sellThreshold() <= previousSell, "SELL must not rise as volatility rises");
            assertTrue(t.sellThreshold() < t.buyThreshold());
            previousBuy = t.buyThreshold();
            previousSell = t.sellThreshold();
        }
    }

    private static MacroResult neutral() {
        return MacroResult.present(0.0, MacroRegime.NEUTRAL, DominanceTrend.FLAT, List.of(), NOW);
    }
}
