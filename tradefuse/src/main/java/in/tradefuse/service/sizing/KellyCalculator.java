package in.tradefuse.service.sizing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Kelly Calculator - Kelly fraction from realized trade statistics.
 *
 * Kelly Formula: f* = (p*b - q) / b
 * Where:
 * - p = win rate
 * - q = loss rate (1-p)
 * - b = payoff ratio (avg win % / avg loss %)
 * - f* = fraction of deployable capital
 *
 * Results are not clamped: f* &lt;= 0 means no statistical edge and the caller decides
 * what to do with it.
 */
public final class KellyCalculator {

    private static final BigDecimal ONE = BigDecimal.ONE;
    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final int SCALE = 6;

    /**
     * Calculate the full Kelly fraction.
     *
     * @param winRate   Win rate p (0.0 to 1.0)
     * @param avgWinPct Average winning trade, positive percent
     * @param avgLossPct Average losing trade, positive percent
     * @return Full Kelly fraction; may be zero or negative
     */
    public static BigDecimal fullKelly(BigDecimal winRate, BigDecimal avgWinPct, BigDecimal avgLossPct) {
        if (avgLossPct.compareTo(ZERO) == 0) {
            // No losses observed: f* = p - q/b tends to p as b grows
            return winRate.setScale(SCALE, RoundingMode.HALF_UP);
        }
        if (avgWinPct.compareTo(ZERO) <= 0) {
            // No winning payoff: f* = p - q/0, any loss rate means no edge
            return winRate.subtract(ONE).setScale(SCALE, RoundingMode.HALF_UP);
        }

        // Payoff ratio b = avg win / avg loss
        BigDecimal payoff = avgWinPct.divide(avgLossPct, SCALE, RoundingMode.HALF_UP);

        // q = 1 - p
        BigDecimal lossRate = ONE.subtract(winRate);

        // Kelly = (p * b - q) / b
        BigDecimal numerator = winRate.multiply(payoff).subtract(lossRate);
        return numerator.divide(payoff, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Apply fractional Kelly (e.g., 0.5 for Half-Kelly).
     *
     * @param kelly Full Kelly fraction
     * @param fraction Fraction to apply
     * @return Fractional Kelly
     */
    public static BigDecimal applyFractionalKelly(BigDecimal kelly, BigDecimal fraction) {
        return kelly.multiply(fraction).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate full Kelly result with all intermediate values.
     */
    public static KellyResult calculateFull(BigDecimal winRate, BigDecimal avgWinPct, BigDecimal avgLossPct,
                                            BigDecimal multiplier) {
        BigDecimal full = fullKelly(winRate, avgWinPct, avgLossPct);
        BigDecimal payoff = avgLossPct.compareTo(ZERO) == 0
            ? ZERO
            : avgWinPct.divide(avgLossPct, 4, RoundingMode.HALF_UP);
        return new KellyResult(winRate, payoff, full, applyFractionalKelly(full, multiplier));
    }

    /**
     * Result of Kelly calculation with all intermediate values.
     */
    public record KellyResult(
        BigDecimal winRate,        // p
        BigDecimal payoffRatio,    // b, zero when no losses were observed
        BigDecimal fullKelly,      // f*
        BigDecimal workingKelly    // f* after the safety multiplier
    ) {
        /**
         * Check if the history shows a statistical edge.
         */
        public boolean hasEdge() {
            return fullKelly.compareTo(ZERO) > 0;
        }

        /**
         * Get summary string.
         */
        public String getSummary() {
            return String.format(
                "p=%.2f%%, b=%.2f, Kelly=%.2f%%, working=%.2f%%",
                winRate.multiply(new BigDecimal("100")).doubleValue(),
                payoffRatio.doubleValue(),
                fullKelly.multiply(new BigDecimal("100")).doubleValue(),
                workingKelly.multiply(new BigDecimal("100")).doubleValue()
            );
        }
    }

    private KellyCalculator() {}
}
