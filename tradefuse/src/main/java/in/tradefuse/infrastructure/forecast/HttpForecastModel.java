package in.tradefuse.infrastructure.forecast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradefuse.application.port.output.ForecastModel;
import in.tradefuse.domain.signal.ForecastPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Forecast model served over HTTP.
 *
 * Request: {"context": [closes...], "prediction_length": n}.
 * Response: {"median": [prices...], "confidence": c}; confidence defaults to 0.5 when absent.
 */
public class HttpForecastModel implements ForecastModel {
    private static final Logger log = LoggerFactory.getLogger(HttpForecastModel.class);

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();

    private final URI endpoint;
    private final Duration timeout;

    public HttpForecastModel(String endpoint, Duration timeout) {
        this.endpoint = URI.create(endpoint);
        this.timeout = timeout;
    }

    @Override
    public ForecastPrediction predict(String instrument, List<BigDecimal> closes, int horizon) {
        try {
            ObjectNode body = objectMapper.createObjectNode();
            ArrayNode context = body.putArray("context");
            closes.forEach(context::add);
            body.put("prediction_length", horizon);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("Forecast endpoint returned HTTP " + response.statusCode());
            }
            return parse(objectMapper.readTree(response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Forecast interrupted for " + instrument, e);
        } catch (Exception e) {
            log.error("Failed to forecast {}: {}", instrument, e.getMessage());
            throw new RuntimeException("Failed to forecast " + instrument, e);
        }
    }

    static ForecastPrediction parse(JsonNode response) {
        List<BigDecimal> median = new ArrayList<>();
        for (JsonNode point : response.path("median")) {
            if (point.isNumber()) {
                median.add(point.decimalValue());
            }
        }
        JsonNode confidenceNode = response.path("confidence");
        double confidence = confidenceNode.isNumber() ? confidenceNode.asDouble() : DEFAULT_CONFIDENCE;
        return new ForecastPrediction(median, confidence);
    }
}
