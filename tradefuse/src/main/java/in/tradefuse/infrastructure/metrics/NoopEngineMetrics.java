package in.tradefuse.infrastructure.metrics;

import in.tradefuse.domain.monitoring.AlertLevel;
import in.tradefuse.domain.order.ExecutionStatus;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TripReason;

import java.time.Duration;

final class NoopEngineMetrics implements EngineMetrics {
    static final NoopEngineMetrics INSTANCE = new NoopEngineMetrics();

    private NoopEngineMetrics() {}

    @Override public void recordDecision(String instrument, Decision decision) {}
    @Override public void recordOrder(String instrument, TradeAction action, ExecutionStatus status, Duration latency) {}
    @Override public void recordVeto(String instrument, String reason) {}
    @Override public void recordCircuitBreakerTrip(TripReason reason) {}
    @Override public void recordFillAnomaly(String instrument, String kind) {}
    @Override public void recordStopRaised(String instrument) {}
    @Override public void recordExternalCallFailure(String operation) {}
    @Override public void recordAlert(AlertLevel level) {}
    @Override public void setOpenPositions(int count) {}
}
