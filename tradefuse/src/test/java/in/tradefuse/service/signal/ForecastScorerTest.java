package in.tradefuse.service.signal;

import in.tradefuse.config.FusionConfig;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.ForecastPrediction;
import in.tradefuse.domain.signal.ForecastResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForecastScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ForecastScorer scorer = new ForecastScorer(FusionConfig.defaults());

    @Test
    void testScoreFromFinalMedianPoint() {
        ForecastPrediction prediction = new ForecastPrediction(
            List.of(new BigDecimal("100.5"), new BigDecimal("101"), new BigDecimal("101.5")), 0.7);

        ForecastResult result = scorer.score("eth_jpy", Timeframe.H1, prediction, new BigDecimal("100"), NOW);

        assertTrue(result.isUsable());
        assertEquals(0.5, result.score(), 1e-9, "+1.5% against a 3% full scale");
        assertEquals(0.7, result.confidence(), 1e-9);
        assertEquals(NOW, result.observedAt());
    }

    @Test
    void testLargeMovesSaturate() {
        ForecastPrediction crash = new ForecastPrediction(List.of(new BigDecimal("90")), 0.9);

        ForecastResult result = scorer.score("eth_jpy", Timeframe.H1, crash, new BigDecimal("100"), NOW);

        assertEquals(-1.0, result.score(), 1e-9);
    }

    @Test
    void testEmptyPredictionIsMissing() {
        ForecastResult result = scorer.score("eth_jpy", Timeframe.H1,
            new ForecastPrediction(List.of(), 0.9), new BigDecimal("100"), NOW);

        assertFalse(result.isUsable());
    }

    @Test
    void testMissingPriceIsMissing() {
        ForecastPrediction prediction = new ForecastPrediction(List.of(new BigDecimal("101")), 0.5);

        assertFalse(scorer.score("eth_jpy", Timeframe.H1, prediction, null, NOW).isUsable());
        assertFalse(scorer.score("eth_jpy", Timeframe.H1, prediction, BigDecimal.ZERO, NOW).isUsable());
    }
}
