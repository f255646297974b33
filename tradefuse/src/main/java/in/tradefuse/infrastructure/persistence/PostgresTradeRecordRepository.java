package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.TradeRecordRepository;
import in.tradefuse.domain.order.FillSource;
import in.tradefuse.domain.signal.ComponentWeights;
import in.tradefuse.domain.trade.TradeAction;
import in.tradefuse.domain.trade.TradeRecord;
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

import static in.tradefuse.infrastructure.persistence.JdbcValues.getDoubleOrNaN;
import static in.tradefuse.infrastructure.persistence.JdbcValues.setDoubleOrNull;
import static in.tradefuse.infrastructure.persistence.JdbcValues.setStringOrNull;

/**
 * PostgreSQL implementation of TradeRecordRepository (append-only).
 */
public final class PostgresTradeRecordRepository implements TradeRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRecordRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresTradeRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(TradeRecord record) {
        try (Connection conn = dataSource.getConnection()) {
            append(conn, record);
        } catch (Exception e) {
            log.error("Failed to append trade record {} {}: {}", record.action(), record.instrument(), e.getMessage(), e);
            throw new RuntimeException("Failed to append trade record", e);
        }
    }

    /**
     * Append on a caller-owned connection, so the write can join a transaction.
     */
    static void append(Connection conn, TradeRecord record) throws SQLException, JsonProcessingException {
        String sql = """
            INSERT INTO trade_records (
                instrument, action, quantity, price, fee, ts,
                order_id, batch_id, score, weights, fill_source
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, record.instrument());
            ps.setString(idx++, record.action().name());
            ps.setBigDecimal(idx++, record.quantity());
            ps.setBigDecimal(idx++, record.price());
            ps.setBigDecimal(idx++, record.fee());
            ps.setTimestamp(idx++, Timestamp.from(record.timestamp()));
            setStringOrNull(ps, idx++, record.orderId());
            setStringOrNull(ps, idx++, record.batchId());
            setDoubleOrNull(ps, idx++, record.score());
            setStringOrNull(ps, idx++, record.weights() == null ? null : MAPPER.writeValueAsString(record.weights()));
            ps.setString(idx, record.fillSource().name());

            ps.executeUpdate();
        }
    }

    @Override
    public List<TradeRecord> findByInstrumentSince(String instrument, Instant since) {
        String sql = """
            SELECT * FROM trade_records
            WHERE instrument = ? AND ts >= ?
            ORDER BY ts ASC, seq ASC
            """;

        List<TradeRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            ps.setTimestamp(2, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find trade records for {}: {}", instrument, e.getMessage(), e);
            throw new RuntimeException("Failed to find trade records", e);
        }
        return records;
    }

    private TradeRecord mapRow(ResultSet rs) throws Exception {
        String weightsJson = rs.getString("weights");
        return new TradeRecord(
            rs.getString("instrument"),
            TradeAction.valueOf(rs.getString("action")),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("price"),
            rs.getBigDecimal("fee"),
            rs.getTimestamp("ts").toInstant(),
            rs.getString("order_id"),
            rs.getString("batch_id"),
            getDoubleOrNaN(rs, "score"),
            weightsJson == null ? null : MAPPER.readValue(weightsJson, ComponentWeights.class),
            FillSource.valueOf(rs.getString("fill_source")));
    }
}
