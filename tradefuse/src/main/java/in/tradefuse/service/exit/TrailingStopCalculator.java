package in.tradefuse.service.exit;

import in.tradefuse.config.TrailingStopConfig;
import in.tradefuse.domain.trade.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tiered trailing stop.
 *
 * Once the gain from entry to peak reaches the activation level, the stop trails the peak
 * by the tier's percentage, never below breakeven plus round-trip fees. The returned stop
 * is never lower than the position's current stop.
 */
public final class TrailingStopCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int PRICE_SCALE = 8;

    private final TrailingStopConfig config;

    public TrailingStopCalculator(TrailingStopConfig config) {
        this.config = config;
    }

    public BigDecimal computeStop(Position position) {
        BigDecimal current = position.stopLoss();
        double gain = position.peakGainPercent().doubleValue();
        double trail = config.trailPercentFor(gain);
        if (trail <= 0) {
            return current;
        }

        BigDecimal candidate = position.peakPrice()
            .multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(trail).divide(HUNDRED)))
            .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        BigDecimal floor = breakevenFloor(position.entryPrice());
        candidate = candidate.max(floor);

        return candidate.compareTo(current) > 0 ? candidate : current;
    }

    /**
     * Entry plus round-trip fees.
     */
    public BigDecimal breakevenFloor(BigDecimal entryPrice) {
        return entryPrice
            .multiply(BigDecimal.ONE.add(BigDecimal.valueOf(config.roundTripFeePercent()).divide(HUNDRED)))
            .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
