package in.tradefuse.infrastructure.persistence;

import in.tradefuse.application.port.output.PositionRepository;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.tradefuse.infrastructure.persistence.JdbcValues.getInstantOrNull;
import static in.tradefuse.infrastructure.persistence.JdbcValues.setBigDecimalOrNull;
import static in.tradefuse.infrastructure.persistence.JdbcValues.setStringOrNull;
import static in.tradefuse.infrastructure.persistence.JdbcValues.setTimestampOrNull;

/**
 * PostgreSQL implementation of PositionRepository.
 *
 * A partial unique index on (instrument) WHERE NOT closed backs the one-open-position rule.
 * Updates are last-writer-wins.
 */
public final class PostgresPositionRepository implements PositionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresPositionRepository.class);

    private final DataSource dataSource;

    public PostgresPositionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(Position position) {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, position);
            log.info("Position inserted: {} {}", position.positionId(), position.instrument());
        } catch (Exception e) {
            log.error("Failed to insert position {}: {}", position.positionId(), e.getMessage(), e);
            throw new RuntimeException("Failed to insert position", e);
        }
    }

    @Override
    public void update(Position position) {
        try (Connection conn = dataSource.getConnection()) {
            update(conn, position);
        } catch (Exception e) {
            log.error("Failed to update position {}: {}", position.positionId(), e.getMessage(), e);
            throw new RuntimeException("Failed to update position", e);
        }
    }

    /**
     * Insert on a caller-owned connection, so the write can join a transaction.
     */
    static void insert(Connection conn, Position position) throws SQLException {
        String sql = """
            INSERT INTO positions (
                position_id, instrument, entry_price, quantity, entry_time,
                stop_loss, take_profit, peak_price, closed,
                exit_price, exit_time, exit_reason, entry_order_id, exit_order_id
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, position.positionId());
            ps.setString(idx++, position.instrument());
            ps.setBigDecimal(idx++, position.entryPrice());
            ps.setBigDecimal(idx++, position.quantity());
            ps.setTimestamp(idx++, Timestamp.from(position.entryTime()));
            ps.setBigDecimal(idx++, position.stopLoss());
            ps.setBigDecimal(idx++, position.takeProfit());
            ps.setBigDecimal(idx++, position.peakPrice());
            ps.setBoolean(idx++, position.closed());
            setBigDecimalOrNull(ps, idx++, position.exitPrice());
            setTimestampOrNull(ps, idx++, position.exitTime());
            setStringOrNull(ps, idx++, position.exitReason() == null ? null : position.exitReason().name());
            setStringOrNull(ps, idx++, position.entryOrderId());
            setStringOrNull(ps, idx, position.exitOrderId());

            ps.executeUpdate();
        }
    }

    static void update(Connection conn, Position position) throws SQLException {
        String sql = """
            UPDATE positions SET
                entry_price = ?, quantity = ?,
                stop_loss = ?, take_profit = ?, peak_price = ?,
                closed = ?, exit_price = ?, exit_time = ?, exit_reason = ?, exit_order_id = ?,
                updated_at = NOW()
            WHERE position_id = ?
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            ps.setBigDecimal(idx++, position.entryPrice());
            ps.setBigDecimal(idx++, position.quantity());
            ps.setBigDecimal(idx++, position.stopLoss());
            ps.setBigDecimal(idx++, position.takeProfit());
            ps.setBigDecimal(idx++, position.peakPrice());
            ps.setBoolean(idx++, position.closed());
            setBigDecimalOrNull(ps, idx++, position.exitPrice());
            setTimestampOrNull(ps, idx++, position.exitTime());
            setStringOrNull(ps, idx++, position.exitReason() == null ? null : position.exitReason().name());
            setStringOrNull(ps, idx++, position.exitOrderId());
            ps.setString(idx, position.positionId());

            int rows = ps.executeUpdate();
            if (rows == 0) {
                throw new IllegalStateException("Position not found: " + position.positionId());
            }
        }
    }

    @Override
    public Optional<Position> findOpen(String instrument) {
        String sql = """
            SELECT * FROM positions
            WHERE instrument = ? AND NOT closed
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find open position for {}: {}", instrument, e.getMessage(), e);
            throw new RuntimeException("Failed to find open position", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Position> findAllOpen() {
        String sql = """
            SELECT * FROM positions
            WHERE NOT closed
            ORDER BY entry_time ASC
            """;

        List<Position> positions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                positions.add(mapRow(rs));
            }
        } catch (Exception e) {
            log.error("Failed to find open positions: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to find open positions", e);
        }
        return positions;
    }

    @Override
    public List<Position> findClosedSince(Instant since) {
        String sql = """
            SELECT * FROM positions
            WHERE closed AND exit_time >= ?
            ORDER BY exit_time DESC
            """;

        List<Position> positions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    positions.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find closed positions since {}: {}", since, e.getMessage(), e);
            throw new RuntimeException("Failed to find closed positions", e);
        }
        return positions;
    }

    private Position mapRow(ResultSet rs) throws Exception {
        String exitReason = rs.getString("exit_reason");
        return new Position(
            rs.getString("position_id"),
            rs.getString("instrument"),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("quantity"),
            rs.getTimestamp("entry_time").toInstant(),
            rs.getBigDecimal("stop_loss"),
            rs.getBigDecimal("take_profit"),
            rs.getBigDecimal("peak_price"),
            rs.getBoolean("closed"),
            rs.getBigDecimal("exit_price"),
            getInstantOrNull(rs, "exit_time"),
            exitReason == null ? null : ExitReason.valueOf(exitReason),
            rs.getString("entry_order_id"),
            rs.getString("exit_order_id"));
    }
}
