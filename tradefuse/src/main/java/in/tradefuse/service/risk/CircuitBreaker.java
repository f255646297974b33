package in.tradefuse.service.risk;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.PositionRepository;
import in.tradefuse.config.CircuitBreakerConfig;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.trade.CircuitBreakerState;
import in.tradefuse.domain.trade.Position;
import in.tradefuse.domain.trade.TripReason;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Circuit Breaker - gates new BUY orders on recent realized losses.
 *
 * Over the closed positions of the trailing window, across all instruments:
 * - realized PnL below -dailyLossLimit trips (DAILY_LOSS_LIMIT)
 * - a loss streak of maxConsecutiveLosses or more trips (LOSS_STREAK)
 * - a streak one below the limit with the latest loss inside the cooldown trips (COOLDOWN)
 *
 * State is derived on every call, never stored. Exits are never gated.
 * When the inputs cannot be read the breaker fails open, after logging and alerting.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final PositionRepository positionRepo;
    private final EngineEventRepository eventRepo;
    private final AlertService alertService;
    private final EngineMetrics metrics;
    private final Clock clock;

    public CircuitBreaker(CircuitBreakerConfig config, PositionRepository positionRepo,
                          EngineEventRepository eventRepo, AlertService alertService,
                          EngineMetrics metrics, Clock clock) {
        this.config = config;
        this.positionRepo = positionRepo;
        this.eventRepo = eventRepo;
        this.alertService = alertService;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
        this.clock = clock;
    }

    /**
     * Derive the breaker state at the current time.
     */
    public CircuitBreakerState evaluate() {
        Instant now = clock.instant();
        List<Position> closed;
        try {
            closed = positionRepo.findClosedSince(now.minus(Duration.ofHours(config.windowHours())));
        } catch (RuntimeException e) {
            log.error("[CIRCUIT-BREAKER] Could not read closed positions, breaker NOT evaluated (fail open): {}",
                e.getMessage(), e);
            if (alertService != null) {
                alertService.sendHighAlert("CIRCUIT_BREAKER_UNAVAILABLE", null,
                    "Circuit breaker could not be evaluated; BUY orders are not gated", Map.of("error", String.valueOf(e.getMessage())));
            }
            return CircuitBreakerState.notEvaluated();
        }
        return evaluate(closed, now);
    }

    /**
     * Pure evaluation over a set of closed positions.
     */
    public CircuitBreakerState evaluate(List<Position> closedPositions, Instant now) {
        List<Position> ordered = new ArrayList<>(closedPositions);
        ordered.removeIf(p -> !p.closed() || p.exitTime() == null);
        ordered.sort(Comparator.comparing(Position::exitTime).reversed());

        BigDecimal realized = BigDecimal.ZERO;
        for (Position p : ordered) {
            realized = realized.add(p.realizedPnl());
        }

        // Streak counts back from the most recent close
        int streak = 0;
        Instant lastLossAt = null;
        for (Position p : ordered) {
            if (!p.isLoss()) {
                break;
            }
            if (lastLossAt == null) {
                lastLossAt = p.exitTime();
            }
            streak++;
        }
        if (lastLossAt == null) {
            lastLossAt = ordered.stream().filter(Position::isLoss).map(Position::exitTime).findFirst().orElse(null);
        }

        TripReason reason = TripReason.NONE;
        if (realized.compareTo(config.dailyLossLimit().negate()) < 0) {
            reason = TripReason.DAILY_LOSS_LIMIT;
        } else if (streak >= config.maxConsecutiveLosses()) {
            reason = TripReason.LOSS_STREAK;
        } else if (streak > 0 && streak == config.maxConsecutiveLosses() - 1
                && lastLossAt != null
                && Duration.between(lastLossAt, now).compareTo(Duration.ofHours(config.cooldownHours())) < 0) {
            reason = TripReason.COOLDOWN;
        }

        return new CircuitBreakerState(realized, streak, lastLossAt, reason, true);
    }

    /**
     * Gate a BUY. Returns the evaluated state; a tripped state must block the order.
     */
    public CircuitBreakerState checkBeforeBuy(String instrument) {
        if (!config.enabled()) {
            return CircuitBreakerState.notEvaluated();
        }
        CircuitBreakerState state = evaluate();
        if (!state.isTripped()) {
            log.debug("[CIRCUIT-BREAKER] {} open: pnl={} streak={}", instrument, state.realizedPnl(), state.consecutiveLosses());
            return state;
        }

        log.warn("[CIRCUIT-BREAKER] ⛔ BUY {} blocked: reason={} pnl={} streak={} lastLoss={}",
            instrument, state.tripReason(), state.realizedPnl(), state.consecutiveLosses(), state.lastLossAt());
        metrics.recordCircuitBreakerTrip(state.tripReason());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", state.tripReason().name());
        details.put("realizedPnl24h", state.realizedPnl().toPlainString());
        details.put("dailyLossLimit", config.dailyLossLimit().toPlainString());
        details.put("consecutiveLosses", state.consecutiveLosses());
        details.put("maxConsecutiveLosses", config.maxConsecutiveLosses());
        details.put("lastLossAt", state.lastLossAt() == null ? null : state.lastLossAt().toString());
        details.put("cooldownHours", config.cooldownHours());

        if (alertService != null) {
            alertService.sendHighAlert("CIRCUIT_BREAKER_TRIPPED", instrument,
                "BUY blocked by circuit breaker (" + state.tripReason() + ")", details);
        }
        if (eventRepo != null) {
            try {
                eventRepo.append(new EngineEvent(EngineEventType.CIRCUIT_BREAKER_TRIPPED, instrument, clock.instant(), details));
            } catch (RuntimeException e) {
                log.warn("[CIRCUIT-BREAKER] Failed to record trip event: {}", e.getMessage());
            }
        }
        return state;
    }
}
