package in.tradefuse.domain.signal;

import in.tradefuse.domain.data.Timeframe;

import java.util.List;
import java.util.Map;

/**
 * Multi-timeframe aggregate for one instrument.
 *
 * When noData is true no timeframe was usable and score is a neutral placeholder
 * that must not be classified as a real signal.
 */
public record AggregatedScore(
    String instrument,
    double score,
    boolean noData,
    double agreementRatio,
    int majorityDirection,
    AlignmentAdjustment adjustment,
    Map<Timeframe, Double> effectiveWeights,
    List<Timeframe> excludedTimeframes
) {
    public AggregatedScore {
        effectiveWeights = effectiveWeights == null ? Map.of() : Map.copyOf(effectiveWeights);
        excludedTimeframes = excludedTimeframes == null ? List.of() : List.copyOf(excludedTimeframes);
    }

    public static AggregatedScore noData(String instrument, List<Timeframe> excluded) {
        return new AggregatedScore(instrument, 0.0, true, 0.0, 0, AlignmentAdjustment.NONE, Map.of(), excluded);
    }
}
