package in.tradefuse.service.signal;

import in.tradefuse.config.FusionConfig;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.ForecastPrediction;
import in.tradefuse.domain.signal.ForecastResult;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Converts a forecast path into a [-1, 1] score.
 *
 * score = clamp(predicted change % of the final median point / full-scale %, -1, 1)
 */
public final class ForecastScorer {

    private final FusionConfig config;

    public ForecastScorer(FusionConfig config) {
        this.config = config;
    }

    public ForecastResult score(String instrument, Timeframe timeframe, ForecastPrediction prediction,
                                BigDecimal currentPrice, Instant observedAt) {
        if (prediction == null || prediction.isEmpty()
                || currentPrice == null || currentPrice.signum() <= 0) {
            return ForecastResult.missing(instrument, timeframe);
        }
        double current = currentPrice.doubleValue();
        double predicted = prediction.finalPoint().doubleValue();
        double changePercent = (predicted - current) / current * 100.0;
        double score = Scores.clampUnit(changePercent / config.forecastFullScalePercent());
        return ForecastResult.present(instrument, timeframe, score,
            Scores.clamp(prediction.confidence(), 0.0, 1.0), observedAt);
    }
}
