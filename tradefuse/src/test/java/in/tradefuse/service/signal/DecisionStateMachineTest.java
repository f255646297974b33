package in.tradefuse.service.signal;

import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.AlignmentAdjustment;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.ThresholdSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionStateMachineTest {

    private final DecisionStateMachine machine = new DecisionStateMachine();
    private final ThresholdSet thresholds = new ThresholdSet("eth_jpy", 0.30, -0.20, 1.0, false);

    @Test
    void testClassifiesAgainstThresholds() {
        assertEquals(Decision.BUY, machine.decide(0.50, thresholds));
        assertEquals(Decision.HOLD, machine.decide(0.10, thresholds));
        assertEquals(Decision.SELL, machine.decide(-0.60, thresholds));
    }

    @Test
    void testBoundariesAreInclusive() {
        assertEquals(Decision.BUY, machine.decide(0.30, thresholds));
        assertEquals(Decision.SELL, machine.decide(-0.20, thresholds));
        assertEquals(Decision.HOLD, machine.decide(0.2999, thresholds));
        assertEquals(Decision.HOLD, machine.decide(-0.1999, thresholds));
    }

    @Test
    void testNonFiniteScoreHolds() {
        assertEquals(Decision.HOLD, machine.decide(Double.NaN, thresholds));
    }

    @Test
    void testNoDataAggregateAlwaysHolds() {
        AggregatedScore flagged = new AggregatedScore("eth_jpy", 0.9, true, 0.0, 0,
            AlignmentAdjustment.NONE, Map.of(), List.of(Timeframe.values()));

        assertEquals(Decision.HOLD, machine.decide(flagged, thresholds));
    }

    @Test
    void testAggregateUsesItsScore() {
        AggregatedScore aggregate = new AggregatedScore("eth_jpy", -0.45, false, 1.0, -1,
            AlignmentAdjustment.BONUS, Map.of(Timeframe.H1, 1.0), List.of());

        assertEquals(Decision.SELL, machine.decide(aggregate, thresholds));
    }

    @Test
    void testInvertedThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdSet("eth_jpy", -0.1, 0.1, 1.0, false));
    }
}
