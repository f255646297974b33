package in.tradefuse.service.mtf;

import in.tradefuse.config.TimeframeConfig;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.AlignmentAdjustment;
import in.tradefuse.domain.signal.TimeframeScore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MultiTimeframeAggregator.
 *
 * Tests:
 * - Weight renormalization over usable timeframes
 * - Staleness exclusion and the no-data case
 * - Alignment bonus and misalignment penalty
 * - Majority direction tie-break
 */
class MultiTimeframeAggregatorTest {

    private static final String ETH = "eth_jpy";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final MultiTimeframeAggregator aggregator = new MultiTimeframeAggregator(TimeframeConfig.defaults());

    @Test
    void testFullAgreementEarnsBonus() {
        Map<Timeframe, TimeframeScore> scores = scores(0.4, 0.4, 0.4, 0.4);

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        assertFalse(result.noData());
        assertEquals(AlignmentAdjustment.BONUS, result.adjustment());
        assertEquals(1.0, result.agreementRatio(), 1e-9);
        assertEquals(1, result.majorityDirection());
        assertEquals(0.4 * 1.15, result.score(), 1e-9);
        assertTrue(result.excludedTimeframes().isEmpty());
    }

    @Test
    void testThreeOfFourAgreeingStillEarnsBonus() {
        Map<Timeframe, TimeframeScore> scores = scores(-0.2, 0.4, 0.4, 0.4);

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        double weighted = 0.20 * -0.2 + 0.35 * 0.4 + 0.30 * 0.4 + 0.15 * 0.4;
        assertEquals(0.75, result.agreementRatio(), 1e-9);
        assertEquals(AlignmentAdjustment.BONUS, result.adjustment());
        assertEquals(weighted * 1.15, result.score(), 1e-9);
    }

    @Test
    void testDisagreementIsPenalized() {
        Map<Timeframe, TimeframeScore> scores = scores(0.5, -0.5, 0.0, 0.3);

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        double weighted = 0.20 * 0.5 + 0.35 * -0.5 + 0.30 * 0.0 + 0.15 * 0.3;
        assertEquals(0.5, result.agreementRatio(), 1e-9);
        assertEquals(AlignmentAdjustment.PENALTY, result.adjustment());
        assertEquals(weighted * 0.85, result.score(), 1e-9);
        assertEquals(1, result.majorityDirection(), "Two of four point up");
    }

    @Test
    void testSingleTimeframeGetsFullWeightAndNoAdjustment() {
        Map<Timeframe, TimeframeScore> scores = new EnumMap<>(Timeframe.class);
        scores.put(Timeframe.H1, TimeframeScore.of(Timeframe.H1, 0.5, NOW));

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        assertEquals(0.5, result.score(), 1e-9);
        assertEquals(AlignmentAdjustment.NONE, result.adjustment());
        assertEquals(1.0, result.effectiveWeights().get(Timeframe.H1), 1e-9);
        assertEquals(List.of(Timeframe.M15, Timeframe.H4, Timeframe.D1), result.excludedTimeframes());
    }

    @Test
    void testWeightsAreRenormalizedOverUsableTimeframes() {
        Map<Timeframe, TimeframeScore> scores = new EnumMap<>(Timeframe.class);
        scores.put(Timeframe.H1, TimeframeScore.of(Timeframe.H1, 0.2, NOW));
        scores.put(Timeframe.H4, TimeframeScore.of(Timeframe.H4, 0.2, NOW));
        scores.put(Timeframe.D1, TimeframeScore.unavailable(Timeframe.D1));

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        double total = result.effectiveWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-9);
        assertEquals(0.35 / 0.65, result.effectiveWeights().get(Timeframe.H1), 1e-9);
        assertEquals(0.30 / 0.65, result.effectiveWeights().get(Timeframe.H4), 1e-9);
        assertTrue(result.excludedTimeframes().contains(Timeframe.D1));
    }

    @Test
    void testStaleTimeframeIsExcluded() {
        Map<Timeframe, TimeframeScore> scores = scores(0.4, 0.4, 0.4, 0.4);
        scores.put(Timeframe.M15, TimeframeScore.of(Timeframe.M15, -0.9, NOW.minus(Duration.ofMinutes(31))));

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        assertTrue(result.excludedTimeframes().contains(Timeframe.M15));
        assertFalse(result.effectiveWeights().containsKey(Timeframe.M15));
        assertEquals(0.4 * 1.15, result.score(), 1e-9);
    }

    @Test
    void testExactlyAtStalenessBoundIsKept() {
        Map<Timeframe, TimeframeScore> scores = new EnumMap<>(Timeframe.class);
        scores.put(Timeframe.M15, TimeframeScore.of(Timeframe.M15, 0.3, NOW.minus(Duration.ofMinutes(30))));

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        assertFalse(result.noData());
        assertEquals(0.3, result.score(), 1e-9);
    }

    @Test
    void testNoUsableTimeframeIsNoData() {
        Map<Timeframe, TimeframeScore> scores = new EnumMap<>(Timeframe.class);
        for (Timeframe tf : Timeframe.values()) {
            scores.put(tf, TimeframeScore.unavailable(tf));
        }

        AggregatedScore result = aggregator.aggregate(ETH, scores, NOW);

        assertTrue(result.noData());
        assertEquals(0.0, result.score());
        assertEquals(4, result.excludedTimeframes().size());
    }

    @Test
    void testBonusIsClamped() {
        AggregatedScore result = aggregator.aggregate(ETH, scores(0.95, 0.95, 0.95, 0.95), NOW);

        assertEquals(1.0, result.score(), 1e-12);
    }

    @Test
    void testMajorityTieResolvesTowardAggregate() {
        assertEquals(-1, MultiTimeframeAggregator.majorityDirection(2, 2, 0, -1));
        assertEquals(1, MultiTimeframeAggregator.majorityDirection(2, 2, 0, 1));
        assertEquals(0, MultiTimeframeAggregator.majorityDirection(1, 1, 1, 0));
        assertEquals(1, MultiTimeframeAggregator.majorityDirection(2, 2, 0, 0));
        assertEquals(-1, MultiTimeframeAggregator.majorityDirection(1, 3, 0, 1));
    }

    private static Map<Timeframe, TimeframeScore> scores(double m15, double h1, double h4, double d1) {
        Map<Timeframe, TimeframeScore> scores = new EnumMap<>(Timeframe.class);
        scores.put(Timeframe.M15, TimeframeScore.of(Timeframe.M15, m15, NOW));
        scores.put(Timeframe.H1, TimeframeScore.of(Timeframe.H1, h1, NOW));
        scores.put(Timeframe.H4, TimeframeScore.of(Timeframe.H4, h4, NOW));
        scores.put(Timeframe.D1, TimeframeScore.of(Timeframe.D1, d1, NOW));
        return scores;
    }
}
