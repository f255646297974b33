package in.tradefuse.infrastructure.persistence;

import in.tradefuse.application.port.output.CandleFeed;
import in.tradefuse.domain.data.Candle;
import in.tradefuse.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads candles written by the upstream price collector.
 */
public final class PostgresCandleFeed implements CandleFeed {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandleFeed.class);

    private final DataSource dataSource;

    public PostgresCandleFeed(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Candle> candles(String instrument, Timeframe timeframe, Instant from, Instant to) {
        String sql = """
            SELECT ts, open, high, low, close, volume
            FROM candles
            WHERE instrument = ? AND timeframe = ? AND ts >= ? AND ts < ?
            ORDER BY ts ASC
            """;

        List<Candle> candles = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            ps.setString(2, timeframe.name());
            ps.setTimestamp(3, Timestamp.from(from));
            ps.setTimestamp(4, Timestamp.from(to));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candles.add(new Candle(
                        instrument,
                        timeframe,
                        rs.getTimestamp("ts").toInstant(),
                        rs.getBigDecimal("open"),
                        rs.getBigDecimal("high"),
                        rs.getBigDecimal("low"),
                        rs.getBigDecimal("close"),
                        rs.getBigDecimal("volume")));
                }
            }
        } catch (Exception e) {
            log.error("Failed to read {} {} candles: {}", instrument, timeframe, e.getMessage(), e);
            throw new RuntimeException("Failed to read candles", e);
        }

        log.debug("Loaded {} {} candles for {}", candles.size(), timeframe, instrument);
        return candles;
    }
}
