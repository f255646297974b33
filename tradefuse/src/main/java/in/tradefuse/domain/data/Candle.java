package in.tradefuse.domain.data;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * OHLCV candle for one instrument and timeframe.
 */
public record Candle(
    String instrument,
    Timeframe timeframe,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);

    /**
     * Range from low to high as a fraction of the close.
     */
    public BigDecimal rangePct() {
        if (close.compareTo(BigDecimal.ZERO) == 0) return BigDecimal.ZERO;
        return high.subtract(low).divide(close, MC);
    }
}
