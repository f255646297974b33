package in.tradefuse.infrastructure.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradefuse.application.port.output.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Slack incoming-webhook notifications.
 *
 * Delivery is best effort: failures are logged and never propagated.
 */
public class SlackNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(SlackNotificationChannel.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();

    private final String webhookUrl;

    public SlackNotificationChannel(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void send(String title, String message) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.debug("[SLACK] No webhook configured, dropping: {}", title);
            return;
        }

        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("text", "*" + title + "*\n" + message);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("[SLACK] Webhook returned HTTP {}: {}", response.statusCode(), response.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SLACK] Interrupted while sending '{}'", title);
        } catch (Exception e) {
            log.warn("[SLACK] Failed to send '{}': {}", title, e.getMessage());
        }
    }
}
