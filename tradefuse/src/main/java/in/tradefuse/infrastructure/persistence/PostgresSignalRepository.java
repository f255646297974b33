package in.tradefuse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradefuse.application.port.output.SignalRepository;
import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.AggregatedScore;
import in.tradefuse.domain.signal.AlignmentAdjustment;
import in.tradefuse.domain.signal.Decision;
import in.tradefuse.domain.signal.InstrumentDecision;
import in.tradefuse.domain.signal.Signal;
import in.tradefuse.domain.signal.ThresholdSet;
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
import java.util.Map;

import static in.tradefuse.infrastructure.persistence.JdbcValues.setBigDecimalOrNull;

/**
 * PostgreSQL implementation of SignalRepository.
 *
 * Signals and decisions are append-only; a repeated write for the same key is ignored.
 */
public final class PostgresSignalRepository implements SignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void save(Signal signal) {
        String sql = """
            INSERT INTO signals (
                instrument, timeframe, ts,
                technical, forecast, sentiment, macro, forecast_confidence,
                weight_technical, weight_forecast, weight_sentiment, weight_macro,
                macro_adjustment, fused_score,
                buy_threshold, sell_threshold, volatility_ratio, macro_adjusted,
                decision, low_confidence
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (instrument, timeframe, ts) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, signal.instrument());
            ps.setString(idx++, signal.timeframe().name());
            ps.setTimestamp(idx++, Timestamp.from(signal.timestamp()));
            ps.setDouble(idx++, signal.technical());
            ps.setDouble(idx++, signal.forecast());
            ps.setDouble(idx++, signal.sentiment());
            ps.setDouble(idx++, signal.macro());
            ps.setDouble(idx++, signal.forecastConfidence());
            ps.setDouble(idx++, signal.weights().technical());
            ps.setDouble(idx++, signal.weights().forecast());
            ps.setDouble(idx++, signal.weights().sentiment());
            ps.setDouble(idx++, signal.weights().macro());
            ps.setDouble(idx++, signal.macroAdjustment());
            ps.setDouble(idx++, signal.fusedScore());
            ps.setDouble(idx++, signal.thresholds().buyThreshold());
            ps.setDouble(idx++, signal.thresholds().sellThreshold());
            ps.setDouble(idx++, signal.thresholds().volatilityRatio());
            ps.setBoolean(idx++, signal.thresholds().macroAdjusted());
            ps.setString(idx++, signal.decision().name());
            ps.setBoolean(idx, signal.lowConfidence());

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to save signal {} {}: {}", signal.instrument(), signal.timeframe(), e.getMessage(), e);
            throw new RuntimeException("Failed to save signal", e);
        }
    }

    @Override
    public void saveDecision(InstrumentDecision decision) {
        String sql = """
            INSERT INTO decisions (
                instrument, ts, score, no_data, agreement_ratio, majority_direction, adjustment,
                effective_weights, excluded_timeframes,
                buy_threshold, sell_threshold, volatility_ratio, macro_adjusted,
                decision, reference_price
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (instrument, ts) DO NOTHING
            """;

        AggregatedScore agg = decision.aggregate();
        ThresholdSet thresholds = decision.thresholds();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, decision.instrument());
            ps.setTimestamp(idx++, Timestamp.from(decision.timestamp()));
            ps.setDouble(idx++, agg.score());
            ps.setBoolean(idx++, agg.noData());
            ps.setDouble(idx++, agg.agreementRatio());
            ps.setInt(idx++, agg.majorityDirection());
            ps.setString(idx++, agg.adjustment().name());
            ps.setString(idx++, MAPPER.writeValueAsString(agg.effectiveWeights()));
            ps.setString(idx++, MAPPER.writeValueAsString(agg.excludedTimeframes()));
            ps.setDouble(idx++, thresholds.buyThreshold());
            ps.setDouble(idx++, thresholds.sellThreshold());
            ps.setDouble(idx++, thresholds.volatilityRatio());
            ps.setBoolean(idx++, thresholds.macroAdjusted());
            ps.setString(idx++, decision.decision().name());
            setBigDecimalOrNull(ps, idx, decision.referencePrice());

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to save decision for {}: {}", decision.instrument(), e.getMessage(), e);
            throw new RuntimeException("Failed to save decision", e);
        }
    }

    @Override
    public List<InstrumentDecision> findActionableDecisions(Instant from, Instant to) {
        String sql = """
            SELECT * FROM decisions
            WHERE ts >= ? AND ts <= ?
              AND decision <> 'HOLD'
            ORDER BY ts ASC
            """;

        List<InstrumentDecision> decisions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(from));
            ps.setTimestamp(2, Timestamp.from(to));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    decisions.add(mapDecision(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find actionable decisions: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to find decisions", e);
        }
        return decisions;
    }

    private InstrumentDecision mapDecision(ResultSet rs) throws Exception {
        String instrument = rs.getString("instrument");
        Map<Timeframe, Double> weights = MAPPER.readValue(rs.getString("effective_weights"),
            new TypeReference<Map<Timeframe, Double>>() {});
        List<Timeframe> excluded = MAPPER.readValue(rs.getString("excluded_timeframes"),
            new TypeReference<List<Timeframe>>() {});

        AggregatedScore aggregate = new AggregatedScore(
            instrument,
            rs.getDouble("score"),
            rs.getBoolean("no_data"),
            rs.getDouble("agreement_ratio"),
            rs.getInt("majority_direction"),
            AlignmentAdjustment.valueOf(rs.getString("adjustment")),
            weights,
            excluded);
        ThresholdSet thresholds = new ThresholdSet(
            instrument,
            rs.getDouble("buy_threshold"),
            rs.getDouble("sell_threshold"),
            rs.getDouble("volatility_ratio"),
            rs.getBoolean("macro_adjusted"));

        return new InstrumentDecision(
            instrument,
            rs.getTimestamp("ts").toInstant(),
            aggregate,
            thresholds,
            Decision.valueOf(rs.getString("decision")),
            rs.getBigDecimal("reference_price"));
    }
}
