package in.tradefuse.domain.trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Long position opened by a BUY fill.
 *
 * stopLoss and peakPrice only move up; the position is closed exactly once.
 */
public record Position(
    String positionId,
    String instrument,
    BigDecimal entryPrice,
    BigDecimal quantity,
    Instant entryTime,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal peakPrice,
    boolean closed,
    BigDecimal exitPrice,
    Instant exitTime,
    ExitReason exitReason,
    String entryOrderId,
    String exitOrderId
) {
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * Open a position with protective levels at fixed percentages around the entry.
     */
    public static Position open(String positionId, String instrument, BigDecimal entryPrice, BigDecimal quantity,
                                Instant entryTime, BigDecimal stopLossPercent, BigDecimal takeProfitPercent,
                                String entryOrderId) {
        BigDecimal stop = entryPrice.multiply(BigDecimal.ONE.subtract(stopLossPercent.divide(HUNDRED)));
        BigDecimal target = entryPrice.multiply(BigDecimal.ONE.add(takeProfitPercent.divide(HUNDRED)));
        return new Position(positionId, instrument, entryPrice, quantity, entryTime,
            stop, target, entryPrice, false, null, null, null, entryOrderId, null);
    }

    /**
     * Raise the peak if price is above it; otherwise this position unchanged.
     */
    public Position withPeak(BigDecimal price) {
        if (price == null || price.compareTo(peakPrice) <= 0) {
            return this;
        }
        return new Position(positionId, instrument, entryPrice, quantity, entryTime,
            stopLoss, takeProfit, price, closed, exitPrice, exitTime, exitReason, entryOrderId, exitOrderId);
    }

    /**
     * Ratchet the stop up to newStop. A lower or equal stop is ignored.
     */
    public Position withStopLoss(BigDecimal newStop) {
        if (newStop == null || newStop.compareTo(stopLoss) <= 0) {
            return this;
        }
        return new Position(positionId, instrument, entryPrice, quantity, entryTime,
            newStop, takeProfit, peakPrice, closed, exitPrice, exitTime, exitReason, entryOrderId, exitOrderId);
    }

    public Position close(BigDecimal price, Instant time, ExitReason reason, String orderId) {
        if (closed) {
            throw new IllegalStateException("Position already closed: " + positionId);
        }
        return new Position(positionId, instrument, entryPrice, quantity, entryTime,
            stopLoss, takeProfit, peakPrice, true, price, time, reason, entryOrderId, orderId);
    }

    /**
     * Gain from entry to peak, in percent.
     */
    public BigDecimal peakGainPercent() {
        return percentChange(entryPrice, peakPrice);
    }

    /**
     * Realized PnL in quote currency; zero while open.
     */
    public BigDecimal realizedPnl() {
        if (!closed || exitPrice == null) {
            return BigDecimal.ZERO;
        }
        return exitPrice.subtract(entryPrice).multiply(quantity);
    }

    public boolean isLoss() {
        return closed && realizedPnl().signum() < 0;
    }

    static BigDecimal percentChange(BigDecimal from, BigDecimal to) {
        if (from.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return to.subtract(from).multiply(HUNDRED).divide(from, 6, RoundingMode.HALF_UP);
    }
}
