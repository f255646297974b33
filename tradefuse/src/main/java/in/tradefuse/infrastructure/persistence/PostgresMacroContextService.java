package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.MacroContextService;
import in.tradefuse.domain.signal.DominanceTrend;
import in.tradefuse.domain.signal.MacroRegime;
import in.tradefuse.domain.signal.MacroResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;

/**
 * Market context from the two most recent market_context rows.
 *
 * The regime comes from the Fear &amp; Greed index of the latest row; the dominance trend
 * compares the reference asset's dominance between the two rows.
 */
public final class PostgresMacroContextService implements MacroContextService {
    private static final Logger log = LoggerFactory.getLogger(PostgresMacroContextService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> LABELS = new TypeReference<>() {};

    // Dominance moves within half a percentage point count as flat
    static final double DOMINANCE_FLAT_BAND_PCT = 0.5;

    private final DataSource dataSource;

    public PostgresMacroContextService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public MacroResult latest() {
        String sql = """
            SELECT ts, score, fear_greed_index, btc_dominance, labels
            FROM market_context
            ORDER BY ts DESC
            LIMIT 2
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (!rs.next()) {
                log.warn("[MACRO] No market context rows");
                return MacroResult.missing();
            }

            Instant observedAt = rs.getTimestamp("ts").toInstant();
            double score = rs.getDouble("score");
            MacroRegime regime = MacroRegime.fromFearGreedIndex(rs.getInt("fear_greed_index"));
            double currentDominance = rs.getDouble("btc_dominance");
            boolean hasCurrentDominance = !rs.wasNull();
            String labelsJson = rs.getString("labels");
            List<String> labels = labelsJson == null ? List.of() : MAPPER.readValue(labelsJson, LABELS);

            DominanceTrend trend = DominanceTrend.FLAT;
            if (hasCurrentDominance && rs.next()) {
                double previousDominance = rs.getDouble("btc_dominance");
                if (!rs.wasNull()) {
                    trend = DominanceTrend.between(previousDominance, currentDominance, DOMINANCE_FLAT_BAND_PCT);
                }
            }

            return MacroResult.present(score, regime, trend, labels, observedAt);
        } catch (Exception e) {
            log.error("Failed to read market context: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to read market context", e);
        }
    }
}
