package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Component weights and confidence handling for score fusion.
 */
public record FusionConfig(
    @JsonProperty("technicalWeight")
    double technicalWeight,         // Base technical weight before the confidence shift

    @JsonProperty("forecastWeight")
    double forecastWeight,          // Base forecast weight before the confidence shift

    @JsonProperty("sentimentWeight")
    double sentimentWeight,

    @JsonProperty("macroWeight")
    double macroWeight,

    @JsonProperty("lowConfidenceCutoff")
    double lowConfidenceCutoff,     // Forecasts below this confidence are damped by confidence/cutoff

    @JsonProperty("confidenceShiftSlope")
    double confidenceShiftSlope,    // Weight shift per unit of confidence above 0.5

    @JsonProperty("maxWeightShift")
    double maxWeightShift,          // Absolute cap on the technical/forecast weight shift

    @JsonProperty("dominanceCorrection")
    double dominanceCorrection,     // Offset for non-reference instruments when dominance moves

    @JsonProperty("forecastFullScalePercent")
    double forecastFullScalePercent, // Predicted move (%) that maps to a forecast score of +/-1

    @JsonProperty("forecastHorizon")
    int forecastHorizon,            // Steps requested from the forecast model

    @JsonProperty("historyCandles")
    int historyCandles,             // Candles sent to the forecast model

    @JsonProperty("minForecastHistory")
    int minForecastHistory,         // Fewer candles than this: forecast is missing

    @JsonProperty("macroFreshnessMinutes")
    long macroFreshnessMinutes      // Macro readings older than this are stale
) {
    private static final double EPSILON = 1e-6;

    public static FusionConfig defaults() {
        return new FusionConfig(
            0.35, 0.35, 0.15, 0.15,
            0.30, 0.16, 0.08, 0.05,
            3.0, 12, 60, 10,
            360
        );
    }

    public boolean isValid() {
        double total = technicalWeight + forecastWeight + sentimentWeight + macroWeight;
        return technicalWeight >= 0 && forecastWeight >= 0 && sentimentWeight >= 0 && macroWeight >= 0
            && Math.abs(total - 1.0) < EPSILON
            && lowConfidenceCutoff > 0 && lowConfidenceCutoff <= 1
            && confidenceShiftSlope >= 0
            && maxWeightShift >= 0 && maxWeightShift <= Math.min(technicalWeight, forecastWeight)
            && dominanceCorrection >= 0 && dominanceCorrection < 1
            && forecastFullScalePercent > 0
            && forecastHorizon > 0
            && historyCandles >= minForecastHistory && minForecastHistory > 0
            && macroFreshnessMinutes > 0;
    }
}
