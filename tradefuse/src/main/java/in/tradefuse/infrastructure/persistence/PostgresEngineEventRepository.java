package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.domain.common.EngineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;

import static in.tradefuse.infrastructure.persistence.JdbcValues.setStringOrNull;

/**
 * PostgreSQL implementation of EngineEventRepository. Payload is stored as JSONB.
 */
public final class PostgresEngineEventRepository implements EngineEventRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEngineEventRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresEngineEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(EngineEvent event) {
        String sql = """
            INSERT INTO engine_events (event_type, instrument, ts, payload)
            VALUES (?, ?, ?, ?::jsonb)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.type().name());
            setStringOrNull(ps, 2, event.instrument());
            ps.setTimestamp(3, Timestamp.from(event.timestamp()));
            ps.setString(4, MAPPER.writeValueAsString(event.payload()));

            ps.executeUpdate();
            log.debug("[EVENT] {} {}", event.type(), event.instrument());
        } catch (Exception e) {
            log.error("Failed to append event {}: {}", event.type(), e.getMessage(), e);
            throw new RuntimeException("Failed to append engine event", e);
        }
    }
}
