package in.tradefuse.service.signal;

import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.output.SignalRepository;
import in.tradefuse.config.EngineConfig;
import in.tradefuse.domain.data.Candle;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.signal.AlignmentAdjustment;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.DominanceTrend;
import in.tradefuse.domain.signal.ForecastPrediction;
import in.tradefuse.domain.signal.InstrumentDecision;
import in.tradefuse.domain.signal.MacroRegime;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.SentimentResult;
import in.tradefuse.domain.signal.Signal;
import in.tradefuse.domain.signal.TechnicalResult;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.support.InMemoryEngineEventRepository;
import in.tradefuse.support.MutableClock;
import in.tradefuse.support.RecordingOrderPublisher;
import in.tradefuse.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ScoringServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:00:00Z");
    private static final String ETH = "eth_jpy";

    private MutableClock clock;
    private SignalRepository signalRepo;
    private RecordingOrderPublisher publisher;
    private InMemoryEngineEventRepository eventRepo;
    private AtomicInteger forecastCalls;

    private MacroResult macro;
    private SentimentResult sentiment;
    private double technicalScore;
    private Instant technicalObservedAt;
    private Timeframe staleTimeframe;
    private List<Candle> candles;

    private ScoringService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        signalRepo = mock(SignalRepository.class);
        publisher = new RecordingOrderPublisher();
        eventRepo = new InMemoryEngineEventRepository();
        forecastCalls = new AtomicInteger();

        macro = MacroResult.missing();
        sentiment = SentimentResult.missing(ETH);
        technicalScore = 0.0;
        technicalObservedAt = NOW.minus(Duration.ofMinutes(5));
        staleTimeframe = null;
        candles = List.of();

        service = new ScoringService(
            EngineConfig.defaults(),
            () -> macro,
            instrument -> sentiment,
            (instrument, tf) -> TechnicalResult.present(instrument, tf, technicalScore, 0.040, Map.of("rsi", 55.0),
                tf == staleTimeframe ? NOW.minus(Duration.ofHours(3)) : technicalObservedAt),
            (instrument, tf, from, to) -> candles,
            (instrument, closes, horizon) -> {
                forecastCalls.incrementAndGet();
                return new ForecastPrediction(List.of(new BigDecimal("101000"), new BigDecimal("103000")), 0.9);
            },
            signalRepo,
            publisher,
            TestEngine.retry(clock),
            null,
            new AlertService(null, eventRepo, null));
    }

    @Test
    void tick_bullishInputsPublishBuy() {
        technicalScore = 1.0;
        sentiment = SentimentResult.present(ETH, 1.0, List.of("ETF inflows"), NOW);
        macro = MacroResult.present(1.0, MacroRegime.NEUTRAL, DominanceTrend.FLAT, List.of(), NOW);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.OK, outcome.status());
        assertEquals(Decision.BUY, outcome.decisionOrHold());
        assertEquals(4, outcome.signalsWritten());
        assertEquals(AlignmentAdjustment.BONUS, outcome.decision().aggregate().adjustment());
        // 0.43 + 0.15 + 0.15 with forecast missing, then the alignment bonus
        assertEquals(0.73 * 1.15, outcome.decision().aggregate().score(), 1e-9);

        List<OrderRequest> published = publisher.published();
        assertEquals(1, published.size());
        OrderRequest request = published.get(0);
        assertEquals(TradeAction.BUY, request.action());
        assertEquals(ETH, request.instrument());
        assertEquals(0.25, request.buyThreshold(), 1e-9);
        assertSame(request, outcome.order());
    }

    @Test
    void tick_bearishInputsPublishSignalSell() {
        technicalScore = -1.0;
        sentiment = SentimentResult.present(ETH, 0.0, List.of(), NOW);
        macro = MacroResult.present(-1.0, MacroRegime.FEAR, DominanceTrend.FLAT, List.of(), NOW);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(Decision.SELL, outcome.decisionOrHold());
        OrderRequest request = publisher.published().get(0);
        assertEquals(TradeAction.SELL, request.action());
        assertEquals(ExitReason.SIGNAL, request.exitReason());
        assertFalse(request.forced());
    }

    @Test
    void tick_neutralInputsHoldWithoutPublishing() {
        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.OK, outcome.status());
        assertEquals(Decision.HOLD, outcome.decisionOrHold());
        assertNull(outcome.order());
        assertTrue(publisher.published().isEmpty());
        verify(signalRepo, times(4)).save(any(Signal.class));
        verify(signalRepo).saveDecision(any(InstrumentDecision.class));
    }

    @Test
    void tick_extremeMacroRaisesBuyThresholdOnly() {
        macro = MacroResult.present(0.0, MacroRegime.EXTREME_GREED, DominanceTrend.FLAT, List.of(), NOW);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertTrue(outcome.decision().thresholds().macroAdjusted());
        assertEquals(0.30, outcome.decision().thresholds().buyThreshold(), 1e-9);
        assertEquals(-0.20, outcome.decision().thresholds().sellThreshold(), 1e-9);
    }

    @Test
    void tick_staleMacroIsIgnored() {
        macro = MacroResult.present(1.0, MacroRegime.EXTREME_GREED, DominanceTrend.FLAT, List.of(),
            NOW.minus(Duration.ofHours(7)));

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertFalse(outcome.decision().thresholds().macroAdjusted());
        ArgumentCaptor<Signal> signals = ArgumentCaptor.forClass(Signal.class);
        verify(signalRepo, times(4)).save(signals.capture());
        for (Signal signal : signals.getAllValues()) {
            assertEquals(0.0, signal.macro(), 1e-12);
        }
    }

    @Test
    void tick_staleTimeframeIsExcludedFromAggregate() {
        technicalScore = 1.0;
        staleTimeframe = Timeframe.M15;

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(List.of(Timeframe.M15), outcome.decision().aggregate().excludedTimeframes());
        assertFalse(outcome.decision().aggregate().effectiveWeights().containsKey(Timeframe.M15));
        assertEquals(4, outcome.signalsWritten(), "Every active timeframe still gets an audit signal");
    }

    @Test
    void tick_noUsableDataHolds() {
        service = new ScoringService(
            EngineConfig.defaults(),
            () -> null,
            instrument -> { throw new IllegalStateException("sentiment offline"); },
            (instrument, tf) -> TechnicalResult.missing(instrument, tf),
            (instrument, tf, from, to) -> List.of(),
            (instrument, closes, horizon) -> null,
            signalRepo,
            publisher,
            TestEngine.retry(clock),
            null,
            null);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.OK, outcome.status());
        assertTrue(outcome.decision().aggregate().noData());
        assertEquals(Decision.HOLD, outcome.decisionOrHold());
        assertTrue(publisher.published().isEmpty());
    }

    @Test
    void tick_forecastNeedsMinimumHistory() {
        candles = candles(5);

        service.tick(TestEngine.context(clock), ETH);

        assertEquals(0, forecastCalls.get());
    }

    @Test
    void tick_forecastAloneCanDriveBuy() {
        service = new ScoringService(
            EngineConfig.defaults(),
            MacroResult::missing,
            SentimentResult::missing,
            (instrument, tf) -> TechnicalResult.missing(instrument, tf),
            (instrument, tf, from, to) -> candles(12),
            (instrument, closes, horizon) -> {
                forecastCalls.incrementAndGet();
                assertEquals(12, closes.size());
                return new ForecastPrediction(List.of(new BigDecimal("101000"), new BigDecimal("103000")), 0.9);
            },
            signalRepo,
            publisher,
            TestEngine.retry(clock),
            null,
            null);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(4, forecastCalls.get());
        // +3% maps to 1.0; confidence 0.9 shifts 0.064 onto the forecast weight
        assertEquals(0.414 * 1.15, outcome.decision().aggregate().score(), 1e-9);
        assertEquals(Decision.BUY, outcome.decisionOrHold());
        assertEquals(0, new BigDecimal("100000").compareTo(outcome.decision().referencePrice()));
    }

    @Test
    void tick_signalWriteFailureStopsTick() {
        technicalScore = 1.0;
        sentiment = SentimentResult.present(ETH, 1.0, List.of(), NOW);
        doThrow(new RuntimeException("disk full")).when(signalRepo).save(any(Signal.class));

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.FAILED, outcome.status());
        assertEquals(0, outcome.signalsWritten());
        assertTrue(publisher.published().isEmpty());
        verify(signalRepo, never()).saveDecision(any());
        assertEquals(1, eventRepo.alerts("SIGNAL_WRITE_FAILED").size());
    }

    @Test
    void tick_decisionWriteFailureDoesNotPublish() {
        technicalScore = 1.0;
        sentiment = SentimentResult.present(ETH, 1.0, List.of(), NOW);
        doThrow(new RuntimeException("constraint")).when(signalRepo).saveDecision(any(InstrumentDecision.class));

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.FAILED, outcome.status());
        assertEquals("decision write failed", outcome.detail());
        assertTrue(publisher.published().isEmpty());
        assertEquals(1, eventRepo.alerts("DECISION_WRITE_FAILED").size());
    }

    @Test
    void tick_publishFailureIsReported() {
        technicalScore = 1.0;
        sentiment = SentimentResult.present(ETH, 1.0, List.of(), NOW);
        publisher.failNext(10);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.FAILED, outcome.status());
        assertEquals("publish failed", outcome.detail());
        assertEquals(Decision.BUY, outcome.decisionOrHold());
        assertEquals(1, eventRepo.alerts("ORDER_PUBLISH_FAILED").size());
    }

    @Test
    void tick_publishRecoversAfterTransientFailure() {
        technicalScore = 1.0;
        sentiment = SentimentResult.present(ETH, 1.0, List.of(), NOW);
        publisher.failNext(1);

        ScoringOutcome outcome = service.tick(TestEngine.context(clock), ETH);

        assertEquals(ScoringOutcome.Status.OK, outcome.status());
        assertEquals(1, publisher.published().size());
    }

    @Test
    void tick_unknownInstrumentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.tick(TestEngine.context(clock), "foo_jpy"));
    }

    private List<Candle> candles(int count) {
        List<Candle> result = new ArrayList<>();
        BigDecimal price = new BigDecimal("100000");
        for (int i = count - 1; i >= 0; i--) {
            result.add(new Candle(ETH, Timeframe.M15, NOW.minus(Duration.ofMinutes(15L * i)),
                price, price, price, price, BigDecimal.ONE));
        }
        return result;
    }
}
