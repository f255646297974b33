package in.tradefuse.infrastructure.forecast;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.domain.signal.ForecastPrediction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class HttpForecastModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parse_readsMedianPathAndConfidence() throws Exception {
        ForecastPrediction prediction = HttpForecastModel.parse(
            mapper.readTree("{\"median\": [101.5, 102, 103.25], \"confidence\": 0.8}"));

        assertEquals(3, prediction.medianPath().size());
        assertEquals(0, new BigDecimal("103.25").compareTo(prediction.finalPoint()));
        assertEquals(0.8, prediction.confidence(), 1e-12);
    }

    @Test
    void parse_defaultsConfidenceAndSkipsNonNumbers() throws Exception {
        ForecastPrediction prediction = HttpForecastModel.parse(
            mapper.readTree("{\"median\": [100, null, \"n/a\", 99]}"));

        assertEquals(2, prediction.medianPath().size());
        assertEquals(HttpForecastModel.DEFAULT_CONFIDENCE, prediction.confidence(), 1e-12);
    }

    @Test
    void parse_emptyResponseIsEmptyPrediction() throws Exception {
        assertTrue(HttpForecastModel.parse(mapper.readTree("{}")).isEmpty());
    }
}
