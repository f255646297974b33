package in.tradefuse.domain.signal;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw forecast model response: the median predicted price path and the model's confidence.
 */
public record ForecastPrediction(
    List<BigDecimal> medianPath,
    double confidence
) {
    public ForecastPrediction {
        medianPath = medianPath == null ? List.of() : List.copyOf(medianPath);
    }

    public boolean isEmpty() {
        return medianPath.isEmpty();
    }

    public BigDecimal finalPoint() {
        return medianPath.get(medianPath.size() - 1);
    }
}
