package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.SentimentService;
import in.tradefuse.domain.signal.SentimentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;

/**
 * Latest news sentiment per instrument. Scores are on [0, 1] with 0.5 neutral.
 */
public final class PostgresSentimentService implements SentimentService {
    private static final Logger log = LoggerFactory.getLogger(PostgresSentimentService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> HEADLINES = new TypeReference<>() {};

    private final DataSource dataSource;

    public PostgresSentimentService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public SentimentResult latest(String instrument) {
        String sql = """
            SELECT ts, score, headlines
            FROM sentiment_scores
            WHERE instrument = ?
            ORDER BY ts DESC
            LIMIT 1
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return SentimentResult.missing(instrument);
                }
                String headlinesJson = rs.getString("headlines");
                List<String> headlines = headlinesJson == null
                    ? List.of()
                    : MAPPER.readValue(headlinesJson, HEADLINES);
                return SentimentResult.present(
                    instrument,
                    rs.getDouble("score"),
                    headlines,
                    rs.getTimestamp("ts").toInstant());
            }
        } catch (Exception e) {
            log.error("Failed to read sentiment for {}: {}", instrument, e.getMessage(), e);
            throw new RuntimeException("Failed to read sentiment", e);
        }
    }
}
