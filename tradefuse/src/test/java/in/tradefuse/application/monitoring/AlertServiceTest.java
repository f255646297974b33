package in.tradefuse.application.monitoring;

import in.tradefuse.application.port.output.NotificationChannel;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.monitoring.AlertLevel;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import in.tradefuse.support.InMemoryEngineEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AlertServiceTest {

    private NotificationChannel channel;
    private InMemoryEngineEventRepository eventRepo;
    private EngineMetrics metrics;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        channel = mock(NotificationChannel.class);
        eventRepo = new InMemoryEngineEventRepository();
        metrics = mock(EngineMetrics.class);
        alertService = new AlertService(channel, eventRepo, metrics);
    }

    @Test
    void highAlertIsNotifiedAndPersisted() {
        alertService.sendHighAlert("CIRCUIT_BREAKER_TRIPPED", "eth_jpy", "3 consecutive losses",
            Map.of("reason", "LOSS_STREAK"));

        verify(channel).send(eq("HIGH CIRCUIT_BREAKER_TRIPPED"), contains("[eth_jpy] 3 consecutive losses"));
        verify(metrics).recordAlert(AlertLevel.HIGH);

        List<EngineEvent> events = eventRepo.alerts("CIRCUIT_BREAKER_TRIPPED");
        assertEquals(1, events.size());
        assertEquals("LOSS_STREAK", events.get(0).payload().get("reason"));
        assertEquals("HIGH", events.get(0).payload().get("level"));
    }

    @Test
    void infoAlertIsOnlyLoggedAndPersisted() {
        alertService.sendInfoAlert("BUY_VETOED", "eth_jpy", "position cap reached");

        verify(channel, never()).send(anyString(), anyString());
        assertEquals(1, eventRepo.alerts("BUY_VETOED").size());
    }

    @Test
    void deliveryFailureDoesNotPropagate() {
        doThrow(new RuntimeException("webhook down")).when(channel).send(anyString(), anyString());

        assertDoesNotThrow(() -> alertService.sendCriticalAlert("BOOKKEEPING_FAILED", "eth_jpy", "manual fix", null));
        assertEquals(1, eventRepo.alerts("BOOKKEEPING_FAILED").size());
    }

    @Test
    void worksWithoutChannelOrEventLog() {
        AlertService bare = new AlertService(null, null, null);

        assertDoesNotThrow(() -> bare.sendMediumAlert("FILL_ESTIMATED", null, "estimated", Map.of()));
    }
}
