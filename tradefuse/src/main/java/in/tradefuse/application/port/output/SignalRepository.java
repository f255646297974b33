package in.tradefuse.application.port.output;

import in.tradefuse.domain.signal.InstrumentDecision;
import in.tradefuse.domain.signal.Signal;

import java.time.Instant;
import java.util.List;

/**
 * Signal and decision store keyed by (instrument[, timeframe], time).
 */
public interface SignalRepository {

    void save(Signal signal);

    void saveDecision(InstrumentDecision decision);

    /**
     * BUY/SELL decisions with from &lt;= timestamp &lt; to, oldest first.
     */
    List<InstrumentDecision> findActionableDecisions(Instant from, Instant to);
}
