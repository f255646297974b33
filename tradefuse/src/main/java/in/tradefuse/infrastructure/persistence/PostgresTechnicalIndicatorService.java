package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.TechnicalIndicatorService;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.TechnicalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Map;

/**
 * Latest technical score per instrument and timeframe, as written by the indicator job.
 */
public final class PostgresTechnicalIndicatorService implements TechnicalIndicatorService {
    private static final Logger log = LoggerFactory.getLogger(PostgresTechnicalIndicatorService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Double>> INDICATORS = new TypeReference<>() {};

    private final DataSource dataSource;

    public PostgresTechnicalIndicatorService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public TechnicalResult latest(String instrument, Timeframe timeframe) {
        String sql = """
            SELECT ts, score, band_width, indicators
            FROM technical_scores
            WHERE instrument = ? AND timeframe = ?
            ORDER BY ts DESC
            LIMIT 1
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument);
            ps.setString(2, timeframe.name());

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    log.debug("No technical score for {} {}", instrument, timeframe);
                    return TechnicalResult.missing(instrument, timeframe);
                }
                String indicatorsJson = rs.getString("indicators");
                Map<String, Double> indicators = indicatorsJson == null
                    ? Map.of()
                    : MAPPER.readValue(indicatorsJson, INDICATORS);
                return TechnicalResult.present(
                    instrument,
                    timeframe,
                    rs.getDouble("score"),
                    rs.getDouble("band_width"),
                    indicators,
                    rs.getTimestamp("ts").toInstant());
            }
        } catch (Exception e) {
            log.error("Failed to read technical score for {} {}: {}", instrument, timeframe, e.getMessage(), e);
            throw new RuntimeException("Failed to read technical score", e);
        }
    }
}
