package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradefuse.domain.data.Timeframe;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Timeframe weights, staleness bounds and directional-agreement parameters.
 */
public record TimeframeConfig(
    @JsonProperty("weights")
    Map<Timeframe, Double> weights,

    @JsonProperty("staleAfterMinutes")
    Map<Timeframe, Long> staleAfterMinutes,

    @JsonProperty("referenceTimeframe")
    Timeframe referenceTimeframe,    // Timeframe whose band width drives threshold calibration

    @JsonProperty("directionBand")
    double directionBand,            // |score| at or below this counts as flat

    @JsonProperty("alignmentThreshold")
    double alignmentThreshold,       // Agreement at or above this earns the bonus

    @JsonProperty("misalignmentThreshold")
    double misalignmentThreshold,    // Agreement at or below this takes the penalty

    @JsonProperty("alignmentBonus")
    double alignmentBonus,

    @JsonProperty("misalignmentPenalty")
    double misalignmentPenalty,

    @JsonProperty("minTimeframesForAdjustment")
    int minTimeframesForAdjustment
) {
    public static TimeframeConfig defaults() {
        Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        Map<Timeframe, Long> stale = new EnumMap<>(Timeframe.class);
        for (Timeframe tf : Timeframe.values()) {
            weights.put(tf, tf.getDefaultWeight());
            stale.put(tf, tf.getDefaultStaleAfterMinutes());
        }
        return new TimeframeConfig(weights, stale, Timeframe.H1, 0.02, 0.75, 0.50, 1.15, 0.85, 2);
    }

    public double weight(Timeframe timeframe) {
        Double w = weights.get(timeframe);
        return w == null ? 0.0 : w;
    }

    public Duration staleAfter(Timeframe timeframe) {
        Long minutes = staleAfterMinutes.get(timeframe);
        return Duration.ofMinutes(minutes == null ? timeframe.getDefaultStaleAfterMinutes() : minutes);
    }

    public boolean isValid() {
        if (weights == null || weights.isEmpty() || staleAfterMinutes == null || referenceTimeframe == null) {
            return false;
        }
        double total = 0;
        for (Double w : weights.values()) {
            if (w == null || w < 0) return false;
            total += w;
        }
        for (Long m : staleAfterMinutes.values()) {
            if (m == null || m <= 0) return false;
        }
        return total > 0
            && weights.containsKey(referenceTimeframe)
            && directionBand >= 0 && directionBand < 1
            && misalignmentThreshold < alignmentThreshold
            && alignmentThreshold <= 1 && misalignmentThreshold >= 0
            && alignmentBonus >= 1.0
            && misalignmentPenalty > 0 && misalignmentPenalty <= 1.0
            && minTimeframesForAdjustment >= 1;
    }
}
