package in.tradefuse.domain.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Effective component weights used for one fusion.
 */
public record ComponentWeights(
    @JsonProperty("technical") double technical,
    @JsonProperty("forecast") double forecast,
    @JsonProperty("sentiment") double sentiment,
    @JsonProperty("macro") double macro
) {
    public double total() {
        return technical + forecast + sentiment + macro;
    }
}
