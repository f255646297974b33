package in.tradefuse.infrastructure.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.OrderQueue;
import in.tradefuse.domain.order.OrderBatch;
import in.tradefuse.domain.order.OrderRequest;
import in.tradefuse.domain.signal.ComponentWeights;
import in.tradefuse.domain.trade.ExitReason;
import in.tradefuse.domain.trade.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order queue backed by a PostgreSQL table.
 *
 * Publishing is idempotent on request_id. Claiming uses FOR UPDATE SKIP LOCKED so concurrent
 * consumers never receive the same request, and a claimed request is never handed out again.
 */
public final class PostgresOrderQueue implements OrderQueue {
    private static final Logger log = LoggerFactory.getLogger(PostgresOrderQueue.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresOrderQueue(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void publish(OrderRequest request) {
        String sql = """
            INSERT INTO order_queue (
                request_id, instrument, action, score, buy_threshold,
                exit_reason, forced, weights, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (request_id) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, request.requestId());
            ps.setString(idx++, request.instrument());
            ps.setString(idx++, request.action().name());
            ps.setDouble(idx++, request.score());
            if (Double.isFinite(request.buyThreshold())) {
                ps.setDouble(idx++, request.buyThreshold());
            } else {
                ps.setNull(idx++, Types.DOUBLE);
            }
            ps.setString(idx++, request.exitReason() == null ? null : request.exitReason().name());
            ps.setBoolean(idx++, request.forced());
            ps.setString(idx++, request.weights() == null ? null : MAPPER.writeValueAsString(request.weights()));
            ps.setTimestamp(idx, Timestamp.from(request.createdAt()));

            int rows = ps.executeUpdate();
            if (rows == 1) {
                log.info("[QUEUE] Published {} {} ({})", request.action(), request.instrument(), request.requestId());
            } else {
                log.debug("[QUEUE] Request {} already queued", request.requestId());
            }
        } catch (Exception e) {
            log.error("Failed to publish order request {}: {}", request.requestId(), e.getMessage(), e);
            throw new RuntimeException("Failed to publish order request", e);
        }
    }

    @Override
    public Optional<OrderBatch> claimBatch(int maxRequests) {
        String sql = """
            UPDATE order_queue SET claimed_batch = ?, claimed_at = NOW()
            WHERE request_id IN (
                SELECT request_id FROM order_queue
                WHERE claimed_batch IS NULL
                ORDER BY created_at ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        String batchId = UUID.randomUUID().toString();
        List<OrderRequest> requests = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, batchId);
            ps.setInt(2, maxRequests);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    requests.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to claim order batch: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to claim order batch", e);
        }

        if (requests.isEmpty()) {
            return Optional.empty();
        }
        // RETURNING does not preserve the subquery order
        requests.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        log.info("[QUEUE] Claimed batch {} with {} requests", batchId, requests.size());
        return Optional.of(new OrderBatch(batchId, requests));
    }

    private OrderRequest mapRow(ResultSet rs) throws SQLException {
        double buyThreshold = rs.getDouble("buy_threshold");
        if (rs.wasNull()) {
            buyThreshold = Double.NaN;
        }
        String exitReason = rs.getString("exit_reason");
        String weightsJson = rs.getString("weights");
        ComponentWeights weights;
        try {
            weights = weightsJson == null ? null : MAPPER.readValue(weightsJson, ComponentWeights.class);
        } catch (Exception e) {
            throw new SQLException("Unreadable weights for request " + rs.getString("request_id"), e);
        }
        return new OrderRequest(
            rs.getString("request_id"),
            rs.getString("instrument"),
            TradeAction.valueOf(rs.getString("action")),
            rs.getDouble("score"),
            buyThreshold,
            exitReason == null ? null : ExitReason.valueOf(exitReason),
            rs.getBoolean("forced"),
            weights,
            rs.getTimestamp("created_at").toInstant());
    }
}
