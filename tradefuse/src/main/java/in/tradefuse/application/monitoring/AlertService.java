package in.tradefuse.application.monitoring;

import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.NotificationChannel;
import in.tradefuse.domain.common.EngineEvent;
import in.tradefuse.domain.common.EngineEventType;
import in.tradefuse.domain.monitoring.Alert;
import in.tradefuse.domain.monitoring.AlertLevel;
import in.tradefuse.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert notification service.
 *
 * Every alert is logged. CRITICAL/HIGH/MEDIUM alerts are also pushed to the notification
 * channel, and every alert is appended to the engine event log. Delivery failures are
 * logged and dropped: alerting never affects trading.
 */
public final class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final NotificationChannel channel;
    private final EngineEventRepository eventRepo;
    private final EngineMetrics metrics;

    public AlertService(NotificationChannel channel, EngineEventRepository eventRepo, EngineMetrics metrics) {
        this.channel = channel;
        this.eventRepo = eventRepo;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
    }

    /**
     * Send alert to configured channels.
     *
     * @param alert Alert to send
     */
    public void sendAlert(Alert alert) {
        String instrument = alert.getInstrument() == null ? "-" : alert.getInstrument();
        switch (alert.getLevel()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} [{}] - {}", alert.getAlertType(), instrument, alert.getMessage());
            case HIGH -> log.warn("[ALERT-HIGH] {} [{}] - {}", alert.getAlertType(), instrument, alert.getMessage());
            case MEDIUM -> log.warn("[ALERT-MEDIUM] {} [{}] - {}", alert.getAlertType(), instrument, alert.getMessage());
            case LOW, INFO -> log.info("[ALERT-INFO] {} [{}] - {}", alert.getAlertType(), instrument, alert.getMessage());
        }

        if (!alert.getDetails().isEmpty()) {
            log.info("[ALERT-DETAILS] {}", alert.getDetails());
        }

        metrics.recordAlert(alert.getLevel());

        if (channel != null && alert.getLevel().isNotifiable()) {
            try {
                channel.send(alert.title(), formatMessage(alert));
            } catch (RuntimeException e) {
                log.warn("[ALERT] Notification delivery failed for {}: {}", alert.getAlertType(), e.getMessage());
            }
        }

        if (eventRepo != null) {
            try {
                Map<String, Object> payload = new LinkedHashMap<>(alert.getDetails());
                payload.put("alertType", alert.getAlertType());
                payload.put("level", alert.getLevel().name());
                payload.put("message", alert.getMessage());
                eventRepo.append(new EngineEvent(EngineEventType.ALERT, alert.getInstrument(), alert.getTimestamp(), payload));
            } catch (RuntimeException e) {
                log.warn("[ALERT] Failed to persist alert {}: {}", alert.getAlertType(), e.getMessage());
            }
        }
    }

    /**
     * Send CRITICAL level alert.
     */
    public void sendCriticalAlert(String alertType, String instrument, String message, Map<String, Object> details) {
        sendAlert(build(alertType, AlertLevel.CRITICAL, instrument, message, details));
    }

    /**
     * Send HIGH level alert.
     */
    public void sendHighAlert(String alertType, String instrument, String message, Map<String, Object> details) {
        sendAlert(build(alertType, AlertLevel.HIGH, instrument, message, details));
    }

    /**
     * Send MEDIUM level alert.
     */
    public void sendMediumAlert(String alertType, String instrument, String message, Map<String, Object> details) {
        sendAlert(build(alertType, AlertLevel.MEDIUM, instrument, message, details));
    }

    /**
     * Send INFO level alert.
     */
    public void sendInfoAlert(String alertType, String instrument, String message) {
        sendAlert(build(alertType, AlertLevel.INFO, instrument, message, Map.of()));
    }

    private static Alert build(String alertType, AlertLevel level, String instrument,
                               String message, Map<String, Object> details) {
        return Alert.builder()
            .alertType(alertType)
            .level(level)
            .instrument(instrument)
            .message(message)
            .details(details)
            .build();
    }

    private static String formatMessage(Alert alert) {
        StringBuilder sb = new StringBuilder();
        if (alert.getInstrument() != null) {
            sb.append('[').append(alert.getInstrument()).append("] ");
        }
        sb.append(alert.getMessage());
        alert.getDetails().forEach((k, v) -> sb.append('\n').append("• ").append(k).append(": ").append(v));
        return sb.toString();
    }
}
