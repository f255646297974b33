package in.tradefuse.application.port.output;

import in.tradefuse.domain.signal.OutcomeWindow;
import in.tradefuse.domain.signal.SignalOutcome;

import java.time.Instant;

public interface SignalOutcomeRepository {

    void save(SignalOutcome outcome);

    boolean exists(String instrument, Instant decisionTime, OutcomeWindow window);
}
