package in.tradefuse.service.sizing;

import java.math.BigDecimal;

/**
 * Result of sizing one BUY.
 *
 * amount is the quote-currency amount to spend, already net of the taker fee;
 * zero when rejected.
 */
public record SizingDecision(
    Basis basis,
    double fraction,
    double scoreFactor,
    BigDecimal deployable,
    BigDecimal amount,
    boolean rejected,
    String reason
) {
    public enum Basis {
        FALLBACK_TABLE, // Too few trades for Kelly
        KELLY,          // Half-Kelly from trade statistics
        NO_EDGE         // Kelly <= 0: minimum fraction
    }

    public static SizingDecision rejected(Basis basis, double fraction, double scoreFactor,
                                          BigDecimal deployable, String reason) {
        return new SizingDecision(basis, fraction, scoreFactor, deployable, BigDecimal.ZERO, true, reason);
    }
}
