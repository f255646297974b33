package in.tradefuse.service.signal;

import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.InstrumentDecision;

/**
 * Result of one scoring tick for one instrument.
 *
 * decision is null unless the tick reached the decision step; order is null unless an
 * order request was published.
 */
public record ScoringOutcome(
    String instrument,
    Status status,
    InstrumentDecision decision,
    OrderRequest order,
    int signalsWritten,
    String detail
) {
    public enum Status {
        OK,
        TIMED_OUT,
        FAILED
    }

    public static ScoringOutcome ok(InstrumentDecision decision, OrderRequest order, int signalsWritten) {
        return new ScoringOutcome(decision.instrument(), Status.OK, decision, order, signalsWritten, "ok");
    }

    public static ScoringOutcome timedOut(String instrument, int signalsWritten) {
        return new ScoringOutcome(instrument, Status.TIMED_OUT, null, null, signalsWritten, "deadline reached");
    }

    public static ScoringOutcome failed(String instrument, InstrumentDecision decision, int signalsWritten, String detail) {
        return new ScoringOutcome(instrument, Status.FAILED, decision, null, signalsWritten, detail);
    }

    public Decision decisionOrHold() {
        return decision == null ? Decision.HOLD : decision.decision();
    }
}
