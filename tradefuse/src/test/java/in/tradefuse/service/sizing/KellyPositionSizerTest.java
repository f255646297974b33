package in.tradefuse.service.sizing;

import in.tradefuse.application.port.output.TradeRecordRepository;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.config.SizingConfig;
import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.order.FillSource;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TradeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KellyPositionSizerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final InstrumentConfig ETH = InstrumentConfig.of("eth", "jpy", "0.001", 8, 0.04, false);

    @Mock
    private TradeRecordRepository tradeRepo;

    private KellyPositionSizer sizer;

    @BeforeEach
    void setUp() {
        sizer = new KellyPositionSizer(SizingConfig.defaults(), tradeRepo);
    }

    @Test
    void size_usesFallbackTableWithShortHistory() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any())).thenReturn(List.of());

        SizingDecision decision = sizer.size(ETH, 0.40, 0.30, jpy("100000"), NOW);

        assertFalse(decision.rejected());
        assertEquals(SizingDecision.Basis.FALLBACK_TABLE, decision.basis());
        assertEquals(0.60, decision.fraction(), 1e-9);
        assertEquals(0, new BigDecimal("99000").compareTo(decision.deployable()));
        assertEquals(0, new BigDecimal("59400").compareTo(decision.amount()));
    }

    @Test
    void size_queriesTheLookbackWindow() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any())).thenReturn(List.of());

        sizer.size(ETH, 0.40, 0.30, jpy("100000"), NOW);

        ArgumentCaptor<Instant> since = ArgumentCaptor.forClass(Instant.class);
        verify(tradeRepo).findByInstrumentSince(eq("eth_jpy"), since.capture());
        assertEquals(NOW.minus(Duration.ofDays(90)), since.getValue());
    }

    @Test
    void size_usesHalfKellyWithEnoughHistory() {
        // 3 wins of +2%, 2 losses of -1%: p=0.6, b=2, f*=0.4, half=0.2
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any()))
            .thenReturn(history("102", "102", "102", "99", "99"));

        SizingDecision decision = sizer.size(ETH, 0.70, 0.30, jpy("100000"), NOW);

        assertEquals(SizingDecision.Basis.KELLY, decision.basis());
        assertEquals(1.0, decision.scoreFactor(), 1e-9);
        assertEquals(0.2, decision.fraction(), 1e-9);
        assertEquals(0, new BigDecimal("19800").compareTo(decision.amount()));
    }

    @Test
    void size_weakScoreShrinksKellyFraction() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any()))
            .thenReturn(history("102", "102", "102", "99", "99"));

        SizingDecision decision = sizer.size(ETH, 0.30, 0.30, jpy("100000"), NOW);

        // 0.2 * 0.3 = 0.06, raised to the 0.10 floor
        assertEquals(0.3, decision.scoreFactor(), 1e-9);
        assertEquals(0.10, decision.fraction(), 1e-9);
    }

    @Test
    void size_noEdgeUsesMinimumFraction() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any()))
            .thenReturn(history("98", "97", "99", "98", "96"));

        SizingDecision decision = sizer.size(ETH, 0.60, 0.30, jpy("100000"), NOW);

        assertEquals(SizingDecision.Basis.NO_EDGE, decision.basis());
        assertEquals(0.10, decision.fraction(), 1e-9);
        assertEquals(0, new BigDecimal("9900").compareTo(decision.amount()));
    }

    @Test
    void size_rejectsWhenNothingIsDeployable() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any())).thenReturn(List.of());

        SizingDecision decision = sizer.size(ETH, 0.50, 0.30, jpy("900"), NOW);

        assertTrue(decision.rejected());
        assertEquals(0, BigDecimal.ZERO.compareTo(decision.amount()));
    }

    @Test
    void size_rejectsBelowMinimumOrder() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any())).thenReturn(List.of());

        // deployable 400, fallback 0.80 -> 320 < 500
        SizingDecision decision = sizer.size(ETH, 0.50, 0.30, jpy("1400"), NOW);

        assertTrue(decision.rejected());
        assertTrue(decision.reason().contains("below minimum"), decision.reason());
    }

    @Test
    void size_fallsBackWhenHistoryIsUnavailable() {
        when(tradeRepo.findByInstrumentSince(eq("eth_jpy"), any())).thenThrow(new RuntimeException("db down"));

        SizingDecision decision = sizer.size(ETH, 0.50, 0.30, jpy("100000"), NOW);

        assertEquals(SizingDecision.Basis.FALLBACK_TABLE, decision.basis());
        assertEquals(0.80, decision.fraction(), 1e-9);
    }

    @Test
    void deployable_excludesReservedFundsAndReserve() {
        Balances balances = new Balances(Map.of("jpy", new BigDecimal("100000")), Map.of("jpy", new BigDecimal("20000")));

        assertEquals(0, new BigDecimal("99000").compareTo(sizer.deployable(ETH, balances)));
    }

    @Test
    void scoreFactor_isLinearBetweenThresholdAndStrongScore() {
        assertEquals(0.3, sizer.scoreFactor(0.30, 0.30), 1e-9);
        assertEquals(0.65, sizer.scoreFactor(0.50, 0.30), 1e-9);
        assertEquals(1.0, sizer.scoreFactor(0.90, 0.30), 1e-9);
        assertEquals(1.0, sizer.scoreFactor(0.40, Double.NaN), 1e-9);
    }

    private static Balances jpy(String amount) {
        return new Balances(Map.of("jpy", new BigDecimal(amount)), Map.of());
    }

    private static List<TradeRecord> history(String... sellPrices) {
        List<TradeRecord> records = new ArrayList<>();
        Instant t = NOW.minus(Duration.ofDays(30));
        for (String sell : sellPrices) {
            records.add(new TradeRecord("eth_jpy", TradeAction.BUY, BigDecimal.ONE, new BigDecimal("100"),
                BigDecimal.ZERO, t, "b", "batch", 0.5, null, FillSource.EXCHANGE));
            t = t.plus(Duration.ofHours(2));
            records.add(new TradeRecord("eth_jpy", TradeAction.SELL, BigDecimal.ONE, new BigDecimal(sell),
                BigDecimal.ZERO, t, "s", "batch", -0.3, null, FillSource.EXCHANGE));
            t = t.plus(Duration.ofHours(2));
        }
        return records;
    }
}
