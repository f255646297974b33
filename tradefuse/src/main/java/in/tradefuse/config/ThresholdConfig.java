package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Base thresholds and calibration bounds.
 */
public record ThresholdConfig(
    @JsonProperty("baseBuy")
    double baseBuy,

    @JsonProperty("baseSell")
    double baseSell,

    @JsonProperty("minVolatilityRatio")
    double minVolatilityRatio,

    @JsonProperty("maxVolatilityRatio")
    double maxVolatilityRatio,

    @JsonProperty("macroAdder")
    double macroAdder,           // Added to the BUY threshold in extreme macro regimes

    @JsonProperty("buyCeiling")
    double buyCeiling            // Absolute cap on the BUY threshold
) {
    public static ThresholdConfig defaults() {
        return new ThresholdConfig(0.25, -0.20, 0.67, 2.0, 0.05, 0.50);
    }

    public boolean isValid() {
        return baseBuy > 0 && baseBuy < 1
            && baseSell < 0 && baseSell > -1
            && minVolatilityRatio > 0 && maxVolatilityRatio >= minVolatilityRatio
            && macroAdder >= 0
            && buyCeiling > 0 && buyCeiling <= 1
            && baseBuy * minVolatilityRatio <= buyCeiling
            && baseSell * maxVolatilityRatio >= -1;
    }
}
