package in.tradefuse.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrailingStopConfigTest {

    @Test
    void defaults_lastTierSitsAboveTakeProfit() {
        TrailingStopConfig config = TrailingStopConfig.defaults();

        List<TrailingStopConfig.TrailTier> unreachable = config.unreachableTiers();

        assertEquals(1, unreachable.size());
        assertEquals(12.0, unreachable.get(0).minGainPercent(), 1e-9);
        assertEquals(1.0, unreachable.get(0).trailPercent(), 1e-9);
    }

    @Test
    void raisedTakeProfit_makesEveryTierReachable() {
        TrailingStopConfig defaults = TrailingStopConfig.defaults();
        TrailingStopConfig config = new TrailingStopConfig(defaults.activationPercent(), defaults.tiers(),
            defaults.roundTripFeePercent(), defaults.initialStopLossPercent(), 15.0);

        assertTrue(config.isValid());
        assertTrue(config.unreachableTiers().isEmpty());
        assertEquals(1.0, config.trailPercentFor(13.0), 1e-9);
    }

    @Test
    void trailPercentFor_tightensWithGain() {
        TrailingStopConfig config = TrailingStopConfig.defaults();

        assertEquals(0.0, config.trailPercentFor(2.9), 1e-9);
        assertEquals(2.0, config.trailPercentFor(3.0), 1e-9);
        assertEquals(1.5, config.trailPercentFor(7.0), 1e-9);
        assertEquals(1.2, config.trailPercentFor(9.0), 1e-9);
    }
}
