package in.tradefuse.infrastructure.metrics;

import in.tradefuse.domain.monitoring.AlertLevel;
import in.tradefuse.domain.order.ExecutionStatus;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TripReason;

import java.time.Duration;

/**
 * Engine metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Decisions per instrument and state
 * - Order outcomes and placement latency
 * - Vetoes, breaker trips and fill anomalies
 * - External call failures after retries
 */
public interface EngineMetrics {

    void recordDecision(String instrument, Decision decision);

    /**
     * Record the outcome of one order request.
     *
     * @param latency Time from request start to result
     */
    void recordOrder(String instrument, TradeAction action, ExecutionStatus status, Duration latency);

    void recordVeto(String instrument, String reason);

    void recordCircuitBreakerTrip(TripReason reason);

    void recordFillAnomaly(String instrument, String kind);

    void recordStopRaised(String instrument);

    void recordExternalCallFailure(String operation);

    void recordAlert(AlertLevel level);

    void setOpenPositions(int count);

    /**
     * Metrics sink that discards everything.
     */
    static EngineMetrics noop() {
        return NoopEngineMetrics.INSTANCE;
    }
}
