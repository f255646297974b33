package in.tradefuse.application.port.output;

import in.tradefuse.domain.data.Candle;
import in.tradefuse.domain.data.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Price/candle feed.
 */
public interface CandleFeed {

    /**
     * Candles with from &lt;= timestamp &lt; to, oldest first.
     */
    List<Candle> candles(String instrument, Timeframe timeframe, Instant from, Instant to);
}
