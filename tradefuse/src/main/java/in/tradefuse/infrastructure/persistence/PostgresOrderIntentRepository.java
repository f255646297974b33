package in.tradefuse.infrastructure.persistence;

import in.tradefuse.application.port.output.OrderIntentRepository;
import in.tradefuse.domain.order.IntentStatus;
import in.tradefuse.domain.order.OrderIntent;
import in.tradefuse.domain.trade.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.util.Optional;

/**
 * PostgreSQL implementation of OrderIntentRepository.
 *
 * claim() is an INSERT ... ON CONFLICT DO NOTHING on the intent key: exactly one caller
 * wins a key, no matter how often a batch is replayed.
 */
public final class PostgresOrderIntentRepository implements OrderIntentRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresOrderIntentRepository.class);

    private final DataSource dataSource;

    public PostgresOrderIntentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean claim(OrderIntent intent) {
        String sql = """
            INSERT INTO order_intents (
                intent_key, batch_id, request_id, instrument, action, status, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (intent_key) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, intent.intentKey());
            ps.setString(2, intent.batchId());
            ps.setString(3, intent.requestId());
            ps.setString(4, intent.instrument());
            ps.setString(5, intent.action().name());
            ps.setString(6, IntentStatus.CLAIMED.name());
            ps.setTimestamp(7, Timestamp.from(intent.createdAt()));

            boolean claimed = ps.executeUpdate() == 1;
            if (!claimed) {
                log.warn("Intent {} already claimed", intent.intentKey());
            }
            return claimed;
        } catch (Exception e) {
            log.error("Failed to claim intent {}: {}", intent.intentKey(), e.getMessage(), e);
            throw new RuntimeException("Failed to claim order intent", e);
        }
    }

    @Override
    public void markPlaced(String intentKey, String orderId) {
        updateStatus(intentKey, IntentStatus.PLACED, orderId, null);
    }

    @Override
    public void markFailed(String intentKey, String detail) {
        updateStatus(intentKey, IntentStatus.FAILED, null, detail);
    }

    private void updateStatus(String intentKey, IntentStatus status, String orderId, String detail) {
        String sql = """
            UPDATE order_intents SET
                status = ?,
                order_id = COALESCE(?, order_id),
                detail = COALESCE(?, detail),
                updated_at = NOW()
            WHERE intent_key = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, orderId);
            ps.setString(3, detail);
            ps.setString(4, intentKey);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to mark intent {} as {}: {}", intentKey, status, e.getMessage(), e);
            throw new RuntimeException("Failed to update order intent", e);
        }
    }

    @Override
    public Optional<OrderIntent> find(String intentKey) {
        String sql = """
            SELECT * FROM order_intents
            WHERE intent_key = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, intentKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new OrderIntent(
                        rs.getString("intent_key"),
                        rs.getString("batch_id"),
                        rs.getString("request_id"),
                        rs.getString("instrument"),
                        TradeAction.valueOf(rs.getString("action")),
                        IntentStatus.valueOf(rs.getString("status")),
                        rs.getString("order_id"),
                        rs.getString("detail"),
                        rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find intent {}: {}", intentKey, e.getMessage(), e);
            throw new RuntimeException("Failed to find order intent", e);
        }
        return Optional.empty();
    }
}
