package in.tradefuse.service.signal;

import in.tradefuse.config.FusionConfig;
import in.tradefuse.domain.signal.ForecastResult;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.NormalizedComponents;
import in.tradefuse.domain.signal.SentimentResult;
import in.tradefuse.domain.signal.TechnicalResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Score Normalizer - brings every component onto [-1, 1].
 *
 * - technical, forecast, macro: already on [-1, 1], clamped
 * - sentiment: [0, 1] remapped with 2x - 1
 * - forecast: damped by confidence / cutoff when confidence is below the cutoff
 *
 * A missing, stale or non-finite component becomes neutral 0 and is listed as missing.
 */
public final class ScoreNormalizer {

    private final FusionConfig config;

    public ScoreNormalizer(FusionConfig config) {
        this.config = config;
    }

    public NormalizedComponents normalize(TechnicalResult technical, ForecastResult forecast,
                                          SentimentResult sentiment, MacroResult macro) {
        List<String> missing = new ArrayList<>();

        double t = 0.0;
        if (technical != null && technical.isUsable() && Double.isFinite(technical.score())) {
            t = Scores.clampUnit(technical.score());
        } else {
            missing.add("technical");
        }

        double f = 0.0;
        double confidence = 0.0;
        if (forecast != null && forecast.isUsable()
                && Double.isFinite(forecast.score()) && Double.isFinite(forecast.confidence())) {
            confidence = Scores.clamp(forecast.confidence(), 0.0, 1.0);
            f = dampForecast(Scores.clampUnit(forecast.score()), confidence);
        } else {
            missing.add("forecast");
        }

        double s = 0.0;
        if (sentiment != null && sentiment.isUsable() && Double.isFinite(sentiment.rawScore())) {
            s = normalizeSentiment(sentiment.rawScore());
        } else {
            missing.add("sentiment");
        }

        double m = 0.0;
        if (macro != null && macro.isUsable() && Double.isFinite(macro.score())) {
            m = Scores.clampUnit(macro.score());
        } else {
            missing.add("macro");
        }

        return new NormalizedComponents(t, f, s, m, confidence, missing);
    }

    /**
     * Map a [0, 1] sentiment (0.5 neutral) onto [-1, 1].
     */
    public double normalizeSentiment(double raw) {
        return 2.0 * Scores.clamp(raw, 0.0, 1.0) - 1.0;
    }

    /**
     * Scale a forecast toward zero when its confidence is below the cutoff.
     */
    public double dampForecast(double score, double confidence) {
        double cutoff = config.lowConfidenceCutoff();
        if (confidence < cutoff) {
            return score * (confidence / cutoff);
        }
        return score;
    }
}
