package in.tradefuse.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Realized result of a BUY/SELL decision after one look-ahead window.
 *
 * priceChangePct is the raw move from entry to exit. maxFavorablePct and maxAdversePct are
 * non-negative excursions with and against the decision's direction.
 */
public record SignalOutcome(
    String instrument,
    Instant decisionTime,
    OutcomeWindow window,
    Decision decision,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    double priceChangePct,
    double maxFavorablePct,
    double maxAdversePct,
    OutcomeLabel label,
    Instant labeledAt
) {
}
