package in.tradefuse.service.signal;

import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.ThresholdSet;

/**
 * Stateless classification of a score against calibrated thresholds.
 *
 * Holdings are not considered here; portfolio vetoes are applied by execution.
 */
public final class DecisionStateMachine {

    public Decision decide(double score, ThresholdSet thresholds) {
        if (!Double.isFinite(score)) {
            return Decision.HOLD;
        }
        if (score >= thresholds.buyThreshold()) {
            return Decision.BUY;
        }
        if (score <= thresholds.sellThreshold()) {
            return Decision.SELL;
        }
        return Decision.HOLD;
    }

    /**
     * An aggregate flagged as no-data is always HOLD.
     */
    public Decision decide(AggregatedScore aggregate, ThresholdSet thresholds) {
        if (aggregate.noData()) {
            return Decision.HOLD;
        }
        return decide(aggregate.score(), thresholds);
    }
}
