package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Loss limits that gate new entries.
 */
public record CircuitBreakerConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("dailyLossLimit")
    BigDecimal dailyLossLimit,      // Realized loss (quote currency) over the window that trips the breaker

    @JsonProperty("maxConsecutiveLosses")
    int maxConsecutiveLosses,

    @JsonProperty("cooldownHours")
    long cooldownHours,

    @JsonProperty("windowHours")
    long windowHours
) {
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(true, new BigDecimal("15000"), 3, 6, 24);
    }

    public boolean isValid() {
        return dailyLossLimit != null && dailyLossLimit.signum() > 0
            && maxConsecutiveLosses > 0
            && cooldownHours >= 0
            && windowHours > 0;
    }
}
