package in.tradefuse.application.port.input;

import in.tradefuse.service.signal.ScoringOutcome;

/**
 * Scheduled scoring unit of work for one instrument.
 */
public interface ScoringTask {

    /**
     * Score every timeframe of the instrument, persist the signals and the decision,
     * and publish an order request on BUY/SELL. Never throws for data or collaborator failures.
     */
    ScoringOutcome tick(InvocationContext ctx, String instrument);
}
