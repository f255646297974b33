package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio policy and execution-guard parameters.
 */
public record ExecutionConfig(
    @JsonProperty("maxOpenPositions")
    int maxOpenPositions,           // Instruments that may be held at the same time

    @JsonProperty("minHoldMinutes")
    long minHoldMinutes,            // Signal SELLs inside this window after entry are vetoed

    @JsonProperty("fillRetryAttempts")
    int fillRetryAttempts,

    @JsonProperty("fillRetryInitialDelayMs")
    long fillRetryInitialDelayMs,

    @JsonProperty("fillRetryMultiplier")
    double fillRetryMultiplier,

    @JsonProperty("entrySanityThreshold")
    double entrySanityThreshold,    // Max relative deviation of an entry fill from the live quote

    @JsonProperty("exitSanityThreshold")
    double exitSanityThreshold,     // Max relative deviation of an exit fill from the live quote

    @JsonProperty("batchSize")
    int batchSize                   // Requests claimed from the order queue per invocation
) {
    public static ExecutionConfig defaults() {
        return new ExecutionConfig(3, 30, 3, 2000, 2.0, 0.50, 0.15, 10);
    }

    public boolean isValid() {
        return maxOpenPositions > 0
            && minHoldMinutes >= 0
            && fillRetryAttempts > 0
            && fillRetryInitialDelayMs > 0
            && fillRetryMultiplier > 1.0
            && entrySanityThreshold > 0 && entrySanityThreshold < 1
            && exitSanityThreshold > 0 && exitSanityThreshold < 1
            && batchSize > 0;
    }
}
