package in.tradefuse.application.port.output;

import in.tradefuse.domain.signal.ForecastPrediction;

import java.math.BigDecimal;
import java.util.List;

/**
 * Time-series forecast model.
 */
public interface ForecastModel {

    /**
     * Predict the median path for the next horizon steps from closing prices (oldest first).
     */
    ForecastPrediction predict(String instrument, List<BigDecimal> closes, int horizon);
}
