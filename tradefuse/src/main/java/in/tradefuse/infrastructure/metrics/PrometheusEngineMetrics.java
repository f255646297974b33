package in.tradefuse.infrastructure.metrics;

import in.tradefuse.domain.monitoring.AlertLevel;
import in.tradefuse.domain.order.ExecutionStatus;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TripReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - engine_decisions_total{instrument, decision}
 * - engine_orders_total{instrument, action, status}
 * - engine_order_latency_seconds{action}
 * - engine_vetoes_total{instrument, reason}
 * - engine_circuit_breaker_trips_total{reason}
 * - engine_fill_anomalies_total{instrument, kind}
 * - engine_stop_raises_total{instrument}
 * - engine_external_call_failures_total{operation}
 * - engine_alerts_total{level}
 * - engine_open_positions
 *
 * Invocations are short-lived, so the registry is exported with {@link MetricsTextfileWriter}
 * rather than scraped.
 */
public class PrometheusEngineMetrics implements EngineMetrics {

    private final CollectorRegistry registry;

    private final Counter decisionCounter;
    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter vetoCounter;
    private final Counter breakerTripCounter;
    private final Counter fillAnomalyCounter;
    private final Counter stopRaiseCounter;
    private final Counter externalFailureCounter;
    private final Counter alertCounter;
    private final Gauge openPositions;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.decisionCounter = Counter.build()
            .name("engine_decisions_total")
            .help("Decisions produced by scoring cycles")
            .labelNames("instrument", "decision")
            .register(registry);

        this.orderCounter = Counter.build()
            .name("engine_orders_total")
            .help("Order requests processed by execution")
            .labelNames("instrument", "action", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("engine_order_latency_seconds")
            .help("Order request processing latency in seconds")
            .labelNames("action")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 20.0, 30.0)
            .register(registry);

        this.vetoCounter = Counter.build()
            .name("engine_vetoes_total")
            .help("Order requests vetoed by portfolio policy or risk gates")
            .labelNames("instrument", "reason")
            .register(registry);

        this.breakerTripCounter = Counter.build()
            .name("engine_circuit_breaker_trips_total")
            .help("BUY requests blocked by a tripped circuit breaker")
            .labelNames("reason")
            .register(registry);

        this.fillAnomalyCounter = Counter.build()
            .name("engine_fill_anomalies_total")
            .help("Fills estimated or substituted because exchange data was missing or implausible")
            .labelNames("instrument", "kind")
            .register(registry);

        this.stopRaiseCounter = Counter.build()
            .name("engine_stop_raises_total")
            .help("Trailing stop ratchets")
            .labelNames("instrument")
            .register(registry);

        this.externalFailureCounter = Counter.build()
            .name("engine_external_call_failures_total")
            .help("External calls that failed after bounded retries")
            .labelNames("operation")
            .register(registry);

        this.alertCounter = Counter.build()
            .name("engine_alerts_total")
            .help("Operator alerts raised")
            .labelNames("level")
            .register(registry);

        this.openPositions = Gauge.build()
            .name("engine_open_positions")
            .help("Open positions seen by the last monitoring cycle")
            .register(registry);
    }

    @Override
    public void recordDecision(String instrument, Decision decision) {
        decisionCounter.labels(instrument, decision.name()).inc();
    }

    @Override
    public void recordOrder(String instrument, TradeAction action, ExecutionStatus status, Duration latency) {
        orderCounter.labels(instrument, action.name(), status.name()).inc();
        orderLatency.labels(action.name()).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordVeto(String instrument, String reason) {
        vetoCounter.labels(instrument, reason).inc();
    }

    @Override
    public void recordCircuitBreakerTrip(TripReason reason) {
        breakerTripCounter.labels(reason.name()).inc();
    }

    @Override
    public void recordFillAnomaly(String instrument, String kind) {
        fillAnomalyCounter.labels(instrument, kind).inc();
    }

    @Override
    public void recordStopRaised(String instrument) {
        stopRaiseCounter.labels(instrument).inc();
    }

    @Override
    public void recordExternalCallFailure(String operation) {
        externalFailureCounter.labels(operation).inc();
    }

    @Override
    public void recordAlert(AlertLevel level) {
        alertCounter.labels(level.name()).inc();
    }

    @Override
    public void setOpenPositions(int count) {
        openPositions.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
