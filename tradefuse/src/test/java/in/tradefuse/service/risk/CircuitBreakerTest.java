package in.tradefuse.service.risk;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.config.CircuitBreakerConfig;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.trade.CircuitBreakerState;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.Position;
import in.tradefuse.domain.trade.TripReason;
import in.tradefuse.support.InMemoryEngineEventRepository;
import in.tradefuse.support.InMemoryPositionRepository;
import in.tradefuse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker.
 *
 * Tests:
 * - Loss limit over the trailing window
 * - Consecutive-loss streak and cooldown
 * - Evaluation is a pure function of the closed positions
 * - Read failures fail open with an alert
 */
class CircuitBreakerTest {

    private static final Instant NOW = Instant.parse("2026-04-10T12:00:00Z");

    private MutableClock clock;
    private InMemoryPositionRepository positionRepo;
    private InMemoryEngineEventRepository eventRepo;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        positionRepo = new InMemoryPositionRepository();
        eventRepo = new InMemoryEngineEventRepository();
        breaker = new CircuitBreaker(CircuitBreakerConfig.defaults(), positionRepo, eventRepo,
            new AlertService(null, eventRepo, null), null, clock);
    }

    @Test
    void testNoHistoryIsOpen() {
        CircuitBreakerState state = breaker.evaluate(List.of(), NOW);

        assertFalse(state.isTripped());
        assertEquals(0, state.consecutiveLosses());
        assertEquals(0, BigDecimal.ZERO.compareTo(state.realizedPnl()));
    }

    @Test
    void testDailyLossLimitTrips() {
        List<Position> closed = List.of(
            closed("p1", "100000", "92000", NOW.minus(Duration.ofHours(10))),
            closed("p2", "100000", "92000", NOW.minus(Duration.ofHours(9))));

        CircuitBreakerState state = breaker.evaluate(closed, NOW);

        assertEquals(TripReason.DAILY_LOSS_LIMIT, state.tripReason());
        assertEquals(0, new BigDecimal("-16000").compareTo(state.realizedPnl()));
    }

    @Test
    void testLossExactlyAtLimitDoesNotTrip() {
        CircuitBreakerState state = breaker.evaluate(
            List.of(closed("p1", "100000", "85000", NOW.minus(Duration.ofHours(10)))), NOW);

        assertFalse(state.isTripped(), "Loss equal to the limit is still allowed");
    }

    @Test
    void testLossStreakTrips() {
        List<Position> closed = List.of(
            closed("p1", "1000", "990", NOW.minus(Duration.ofHours(20))),
            closed("p2", "1000", "990", NOW.minus(Duration.ofHours(15))),
            closed("p3", "1000", "990", NOW.minus(Duration.ofHours(12))));

        CircuitBreakerState state = breaker.evaluate(closed, NOW);

        assertEquals(TripReason.LOSS_STREAK, state.tripReason());
        assertEquals(3, state.consecutiveLosses());
    }

    @Test
    void testWinResetsStreak() {
        List<Position> closed = List.of(
            closed("p1", "1000", "990", NOW.minus(Duration.ofHours(20))),
            closed("p2", "1000", "990", NOW.minus(Duration.ofHours(15))),
            closed("p3", "1000", "990", NOW.minus(Duration.ofHours(12))),
            closed("p4", "1000", "1010", NOW.minus(Duration.ofHours(1))));

        CircuitBreakerState state = breaker.evaluate(closed, NOW);

        assertFalse(state.isTripped());
        assertEquals(0, state.consecutiveLosses());
    }

    @Test
    void testCooldownAfterNearStreak() {
        List<Position> closed = List.of(
            closed("p1", "1000", "990", NOW.minus(Duration.ofHours(5))),
            closed("p2", "1000", "990", NOW.minus(Duration.ofHours(2))));

        CircuitBreakerState state = breaker.evaluate(closed, NOW);

        assertEquals(TripReason.COOLDOWN, state.tripReason());
        assertEquals(NOW.minus(Duration.ofHours(2)), state.lastLossAt());
    }

    @Test
    void testCooldownExpires() {
        List<Position> closed = List.of(
            closed("p1", "1000", "990", NOW.minus(Duration.ofHours(9))),
            closed("p2", "1000", "990", NOW.minus(Duration.ofHours(7))));

        assertFalse(breaker.evaluate(closed, NOW).isTripped());
    }

    @Test
    void testEvaluationIgnoresInputOrder() {
        List<Position> closed = new ArrayList<>(List.of(
            closed("p1", "1000", "1010", NOW.minus(Duration.ofHours(20))),
            closed("p2", "1000", "990", NOW.minus(Duration.ofHours(15))),
            closed("p3", "1000", "990", NOW.minus(Duration.ofHours(3)))));

        CircuitBreakerState first = breaker.evaluate(closed, NOW);
        Collections.reverse(closed);
        CircuitBreakerState second = breaker.evaluate(closed, NOW);

        assertEquals(first, second);
        assertEquals(2, first.consecutiveLosses());
    }

    @Test
    void testCheckBeforeBuyRecordsTrip() {
        insertClosed("p1", "1000", "990", NOW.minus(Duration.ofHours(20)));
        insertClosed("p2", "1000", "990", NOW.minus(Duration.ofHours(15)));
        insertClosed("p3", "1000", "990", NOW.minus(Duration.ofHours(12)));

        CircuitBreakerState state = breaker.checkBeforeBuy("eth_jpy");

        assertTrue(state.isTripped());
        assertEquals(1, eventRepo.ofType(EngineEventType.CIRCUIT_BREAKER_TRIPPED).size());
        assertEquals(1, eventRepo.alerts("CIRCUIT_BREAKER_TRIPPED").size());
        assertEquals("LOSS_STREAK", eventRepo.ofType(EngineEventType.CIRCUIT_BREAKER_TRIPPED).get(0).payload().get("reason"));
    }

    @Test
    void testLossesOutsideWindowAreIgnored() {
        insertClosed("p1", "100000", "80000", NOW.minus(Duration.ofHours(30)));

        assertFalse(breaker.checkBeforeBuy("eth_jpy").isTripped());
    }

    @Test
    void testUnreadableHistoryFailsOpen() {
        positionRepo.failReads(true);

        CircuitBreakerState state = breaker.checkBeforeBuy("eth_jpy");

        assertFalse(state.isTripped());
        assertFalse(state.evaluated());
        assertEquals(1, eventRepo.alerts("CIRCUIT_BREAKER_UNAVAILABLE").size());
    }

    @Test
    void testDisabledBreakerNeverTrips() {
        CircuitBreaker disabled = new CircuitBreaker(
            new CircuitBreakerConfig(false, new BigDecimal("15000"), 3, 6, 24),
            positionRepo, eventRepo, null, null, clock);
        insertClosed("p1", "100000", "50000", NOW.minus(Duration.ofHours(1)));

        assertFalse(disabled.checkBeforeBuy("eth_jpy").isTripped());
    }

    private void insertClosed(String id, String entry, String exit, Instant exitTime) {
        positionRepo.insert(closed(id, entry, exit, exitTime));
    }

    private static Position closed(String id, String entry, String exit, Instant exitTime) {
        Position open = Position.open(id, "eth_jpy", new BigDecimal(entry), BigDecimal.ONE,
            exitTime.minus(Duration.ofHours(1)), new BigDecimal("5"), new BigDecimal("10"), "o-" + id);
        BigDecimal exitPrice = new BigDecimal(exit);
        ExitReason reason = exitPrice.compareTo(open.entryPrice()) < 0 ? ExitReason.STOP_LOSS : ExitReason.SIGNAL;
        return open.close(exitPrice, exitTime, reason, "x-" + id);
    }
}
