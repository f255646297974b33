package in.tradefuse.infrastructure.persistence;

import in.tradefuse.application.port.output.SignalOutcomeRepository;
import in.tradefuse.domain.signal.OutcomeWindow;
import in.tradefuse.domain.signal.SignalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * PostgreSQL implementation of SignalOutcomeRepository.
 */
public final class PostgresSignalOutcomeRepository implements SignalOutcomeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalOutcomeRepository.class);

    private final DataSource dataSource;

    public PostgresSignalOutcomeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void save(SignalOutcome outcome) {
        String sql = """
            INSERT INTO decision_outcomes (
                instrument, decision_time, window_name, decision,
                entry_price, exit_price, price_change_pct, max_favorable_pct, max_adverse_pct,
                label, labeled_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (instrument, decision_time, window_name) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, outcome.instrument());
            ps.setTimestamp(idx++, Timestamp.from(outcome.decisionTime()));
            ps.setString(idx++, outcome.window().name());
            ps.setString(idx++, outcome.decision().name());
            ps.setBigDecimal(idx++, outcome.entryPrice());
            ps.setBigDecimal(idx++, outcome.exitPrice());
            ps.setDouble(idx++, outcome.priceChangePct());
            ps.setDouble(idx++, outcome.maxFavorablePct());
            ps.setDouble(idx++, outcome.maxAdversePct());
            ps.setString(idx++, outcome.label().name());
            ps.setTimestamp(idx, Timestamp.from(outcome.labeledAt()));

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to save outcome {} {} {}: {}",
                outcome.instrument(), outcome.decisionTime(), outcome.window(), e.getMessage(), e);
            throw new RuntimeException("Failed to save signal outcome", e);
        }
    }

    @Override
    public boolean exists(String instrument, Instant decisionTime, OutcomeWindow window) {
        String sql = """
            SELECT 1 FROM decision_outcomes
            WHERE instrument = ? AND decision_time = ? AND window_name = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            ps.setTimestamp(2, Timestamp.from(decisionTime));
            ps.setString(3, window.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (Exception e) {
            log.error("Failed to check outcome for {}: {}", instrument, e.getMessage(), e);
            throw new RuntimeException("Failed to check signal outcome", e);
        }
    }
}
