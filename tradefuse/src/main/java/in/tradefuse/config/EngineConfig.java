package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Versioned engine configuration, injected explicitly into every component.
 */
public record EngineConfig(
    @JsonProperty("version")
    String version,

    @JsonProperty("fusion")
    FusionConfig fusion,

    @JsonProperty("timeframes")
    TimeframeConfig timeframes,

    @JsonProperty("thresholds")
    ThresholdConfig thresholds,

    @JsonProperty("sizing")
    SizingConfig sizing,

    @JsonProperty("circuitBreaker")
    CircuitBreakerConfig circuitBreaker,

    @JsonProperty("trailingStop")
    TrailingStopConfig trailingStop,

    @JsonProperty("execution")
    ExecutionConfig execution,

    @JsonProperty("outcome")
    OutcomeConfig outcome,

    @JsonProperty("instruments")
    List<InstrumentConfig> instruments
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            "defaults",
            FusionConfig.defaults(),
            TimeframeConfig.defaults(),
            ThresholdConfig.defaults(),
            SizingConfig.defaults(),
            CircuitBreakerConfig.defaults(),
            TrailingStopConfig.defaults(),
            ExecutionConfig.defaults(),
            OutcomeConfig.defaults(),
            List.of(
                InstrumentConfig.of("btc", "jpy", "0.001", 8, 0.030, true),
                InstrumentConfig.of("eth", "jpy", "0.001", 8, 0.040, false),
                InstrumentConfig.of("xrp", "jpy", "1.0", 6, 0.050, false),
                InstrumentConfig.of("sol", "jpy", "0.01", 8, 0.060, false),
                InstrumentConfig.of("doge", "jpy", "1.0", 2, 0.070, false),
                InstrumentConfig.of("avax", "jpy", "0.01", 8, 0.060, false)
            )
        );
    }

    public Optional<InstrumentConfig> instrument(String symbol) {
        return instruments.stream().filter(i -> i.symbol().equals(symbol)).findFirst();
    }

    public InstrumentConfig requireInstrument(String symbol) {
        return instrument(symbol)
            .orElseThrow(() -> new IllegalArgumentException("Unknown instrument: " + symbol));
    }

    public boolean isValid() {
        return version != null && !version.isBlank()
            && fusion != null && fusion.isValid()
            && timeframes != null && timeframes.isValid()
            && thresholds != null && thresholds.isValid()
            && sizing != null && sizing.isValid()
            && circuitBreaker != null && circuitBreaker.isValid()
            && trailingStop != null && trailingStop.isValid()
            && execution != null && execution.isValid()
            && outcome != null && outcome.isValid()
            && instruments != null && !instruments.isEmpty()
            && instruments.stream().allMatch(InstrumentConfig::isValid);
    }
}
