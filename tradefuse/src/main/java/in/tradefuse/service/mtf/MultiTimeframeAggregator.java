package in.tradefuse.service.mtf;

import in.tradefuse.config.TimeframeConfig;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.AlignmentAdjustment;
import in.tradefuse.domain.signal.TimeframeScore;
import in.tradefuse.service.signal.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-Timeframe Aggregator.
 *
 * 1. Drop timeframes that are unavailable or older than their staleness bound
 * 2. Renormalize the remaining weights to sum to 1
 * 3. Weighted sum of per-timeframe scores
 * 4. Directional agreement: share of timeframes in the majority direction (up/down/flat)
 * 5. Bonus above the alignment threshold, penalty at or below the misalignment threshold
 *
 * The adjustment only applies with at least two timeframes. The result is clamped to [-1, 1].
 */
public final class MultiTimeframeAggregator {
    private static final Logger log = LoggerFactory.getLogger(MultiTimeframeAggregator.class);

    private final TimeframeConfig config;

    public MultiTimeframeAggregator(TimeframeConfig config) {
        this.config = config;
    }

    public AggregatedScore aggregate(String instrument, Map<Timeframe, TimeframeScore> scores, Instant now) {
        List<Timeframe> excluded = new ArrayList<>();
        Map<Timeframe, TimeframeScore> usable = new EnumMap<>(Timeframe.class);

        for (Timeframe tf : Timeframe.values()) {
            if (config.weight(tf) <= 0) {
                continue;
            }
            TimeframeScore entry = scores.get(tf);
            if (!isUsable(entry, tf, now)) {
                excluded.add(tf);
                continue;
            }
            usable.put(tf, entry);
        }

        if (usable.isEmpty()) {
            log.warn("[MTF] {} no usable timeframe, excluded={}", instrument, excluded);
            return AggregatedScore.noData(instrument, excluded);
        }

        double totalWeight = 0;
        for (Timeframe tf : usable.keySet()) {
            totalWeight += config.weight(tf);
        }

        Map<Timeframe, Double> effective = new EnumMap<>(Timeframe.class);
        double weighted = 0;
        int up = 0;
        int down = 0;
        int flat = 0;
        for (Map.Entry<Timeframe, TimeframeScore> e : usable.entrySet()) {
            double w = config.weight(e.getKey()) / totalWeight;
            double s = Scores.clampUnit(e.getValue().score());
            effective.put(e.getKey(), w);
            weighted += w * s;
            switch (Scores.direction(s, config.directionBand())) {
                case 1 -> up++;
                case -1 -> down++;
                default -> flat++;
            }
        }

        int n = usable.size();
        int aggregateDirection = Scores.direction(weighted, config.directionBand());
        int majority = majorityDirection(up, down, flat, aggregateDirection);
        double agreement = (double) Math.max(up, Math.max(down, flat)) / n;

        AlignmentAdjustment adjustment = AlignmentAdjustment.NONE;
        double score = weighted;
        if (n >= config.minTimeframesForAdjustment()) {
            if (agreement >= config.alignmentThreshold()) {
                adjustment = AlignmentAdjustment.BONUS;
                score = weighted * config.alignmentBonus();
            } else if (agreement <= config.misalignmentThreshold()) {
                adjustment = AlignmentAdjustment.PENALTY;
                score = weighted * config.misalignmentPenalty();
            }
        }
        score = Scores.clampUnit(score);

        log.debug("[MTF] {} score={} agreement={} adjustment={} used={} excluded={}",
            instrument, String.format("%.4f", score), String.format("%.2f", agreement), adjustment, usable.keySet(), excluded);

        return new AggregatedScore(instrument, score, false, agreement, majority, adjustment, effective, excluded);
    }

    private boolean isUsable(TimeframeScore entry, Timeframe tf, Instant now) {
        if (entry == null || !entry.available() || !Double.isFinite(entry.score())) {
            return false;
        }
        if (entry.observedAt() == null) {
            return false;
        }
        Duration age = Duration.between(entry.observedAt(), now);
        return age.compareTo(config.staleAfter(tf)) <= 0;
    }

    /**
     * Majority direction; ties resolve toward the direction of the aggregate.
     */
    static int majorityDirection(int up, int down, int flat, int aggregateDirection) {
        int max = Math.max(up, Math.max(down, flat));
        int candidates = (up == max ? 1 : 0) + (down == max ? 1 : 0) + (flat == max ? 1 : 0);
        if (candidates > 1) {
            int countForAggregate = aggregateDirection > 0 ? up : aggregateDirection < 0 ? down : flat;
            if (countForAggregate == max) {
                return aggregateDirection;
            }
        }
        if (up == max) return 1;
        if (down == max) return -1;
        return 0;
    }
}
