package in.tradefuse.service.signal;

import in.tradefuse.config.FusionConfig;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.DominanceTrend;
import in.tradefuse.domain.signal.ForecastResult;
import in.tradefuse.domain.signal.MacroRegime;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.NormalizedComponents;
import in.tradefuse.domain.signal.SentimentResult;
import in.tradefuse.domain.signal.TechnicalResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoreNormalizerTest {

    private static final String ETH = "eth_jpy";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ScoreNormalizer normalizer = new ScoreNormalizer(FusionConfig.defaults());

    @Test
    void testAllComponentsPresent() {
        NormalizedComponents c = normalizer.normalize(
            technical(0.4),
            ForecastResult.present(ETH, Timeframe.H1, 0.6, 0.8, NOW),
            SentimentResult.present(ETH, 0.75, List.of("upgrade shipped"), NOW),
            MacroResult.present(-0.2, MacroRegime.NEUTRAL, DominanceTrend.FLAT, List.of(), NOW));

        assertEquals(0.4, c.technical(), 1e-9);
        assertEquals(0.6, c.forecast(), 1e-9, "Confident forecast is not damped");
        assertEquals(0.5, c.sentiment(), 1e-9, "0.75 maps to 0.5");
        assertEquals(-0.2, c.macro(), 1e-9);
        assertEquals(0.8, c.forecastConfidence(), 1e-9);
        assertTrue(c.missingComponents().isEmpty());
        assertFalse(c.isLowConfidence());
    }

    @Test
    void testMissingComponentsBecomeNeutral() {
        NormalizedComponents c = normalizer.normalize(
            TechnicalResult.missing(ETH, Timeframe.H1),
            null,
            SentimentResult.missing(ETH),
            MacroResult.missing());

        assertEquals(0.0, c.technical());
        assertEquals(0.0, c.forecast());
        assertEquals(0.0, c.sentiment());
        assertEquals(0.0, c.macro());
        assertEquals(List.of("technical", "forecast", "sentiment", "macro"), c.missingComponents());
        assertTrue(c.isLowConfidence());
    }

    @Test
    void testStaleMacroIsTreatedAsMissing() {
        MacroResult stale = MacroResult.present(0.9, MacroRegime.EXTREME_GREED, DominanceTrend.FLAT, List.of(), NOW)
            .asStale();

        NormalizedComponents c = normalizer.normalize(technical(0.1), null, null, stale);

        assertEquals(0.0, c.macro());
        assertTrue(c.missingComponents().contains("macro"));
    }

    @Test
    void testNonFiniteInputsAreReplaced() {
        NormalizedComponents c = normalizer.normalize(
            technical(Double.NaN),
            ForecastResult.present(ETH, Timeframe.H1, Double.POSITIVE_INFINITY, 0.9, NOW),
            SentimentResult.present(ETH, Double.NaN, List.of(), NOW),
            MacroResult.present(Double.NEGATIVE_INFINITY, MacroRegime.FEAR, DominanceTrend.FLAT, List.of(), NOW));

        assertEquals(0.0, c.technical());
        assertEquals(0.0, c.forecast());
        assertEquals(0.0, c.sentiment());
        assertEquals(0.0, c.macro());
        assertEquals(4, c.missingComponents().size());
    }

    @Test
    void testOutOfRangeScoresAreClamped() {
        NormalizedComponents c = normalizer.normalize(
            technical(1.7),
            ForecastResult.present(ETH, Timeframe.H1, -3.0, 1.0, NOW),
            SentimentResult.present(ETH, 1.4, List.of(), NOW),
            MacroResult.present(-5.0, MacroRegime.EXTREME_FEAR, DominanceTrend.FLAT, List.of(), NOW));

        assertEquals(1.0, c.technical());
        assertEquals(-1.0, c.forecast());
        assertEquals(1.0, c.sentiment());
        assertEquals(-1.0, c.macro());
    }

    @Test
    void testLowConfidenceForecastIsDamped() {
        // Confidence 0.15 is half the 0.30 cutoff
        NormalizedComponents c = normalizer.normalize(
            technical(0.0),
            ForecastResult.present(ETH, Timeframe.H1, 0.8, 0.15, NOW),
            null,
            null);

        assertEquals(0.4, c.forecast(), 1e-9);
        assertEquals(0.15, c.forecastConfidence(), 1e-9);
    }

    @Test
    void testSentimentMapping() {
        assertEquals(-1.0, normalizer.normalizeSentiment(0.0), 1e-9);
        assertEquals(0.0, normalizer.normalizeSentiment(0.5), 1e-9);
        assertEquals(1.0, normalizer.normalizeSentiment(1.0), 1e-9);
        assertEquals(-0.2, normalizer.normalizeSentiment(0.4), 1e-9);
    }

    private static TechnicalResult technical(double score) {
        return TechnicalResult.present(ETH, Timeframe.H1, score, 0.04, Map.of("rsi", 55.0), NOW);
    }
}
