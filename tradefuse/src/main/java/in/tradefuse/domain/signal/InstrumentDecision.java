package in.tradefuse.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-instrument decision of one scoring cycle, persisted for audit and outcome labeling.
 *
 * referencePrice is the last close seen by the cycle, or null when no candle was available.
 */
public record InstrumentDecision(
    String instrument,
    Instant timestamp,
    AggregatedScore aggregate,
    ThresholdSet thresholds,
    Decision decision,
    BigDecimal referencePrice
) {
}
