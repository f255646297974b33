package in.tradefuse.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine Schema Migration - creates engine tables on startup.
 *
 * Engine-owned tables:
 * - signals, decisions, decision_outcomes: scoring audit trail and labels
 * - positions, trade_records, order_intents, engine_events: execution state
 * - order_queue: requests handed from scoring/monitoring to execution
 *
 * Collaborator tables (written by the upstream collectors, read here):
 * - candles, technical_scores, sentiment_scores, market_context
 */
public final class EngineSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(EngineSchemaMigration.class);

    private final DataSource dataSource;

    public EngineSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables and indexes.
     */
    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting engine schema migration");

        try (Connection conn = dataSource.getConnection()) {
            for (Map.Entry<String, String> table : tables().entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.debug("[SCHEMA MIGRATION] {} table already exists", table.getKey());
                    continue;
                }
                log.info("[SCHEMA MIGRATION] Creating {} table...", table.getKey());
                execute(conn, table.getValue());
                log.info("[SCHEMA MIGRATION] ✓ {} table created", table.getKey());
            }
            createIndexes(conn);
            log.info("[SCHEMA MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Engine schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void createIndexes(Connection conn) throws Exception {
        // One open position per instrument
        execute(conn, """
            CREATE UNIQUE INDEX IF NOT EXISTS ux_positions_open_instrument
                ON positions (instrument) WHERE NOT closed
            """);
        execute(conn, """
            CREATE INDEX IF NOT EXISTS ix_positions_exit_time
                ON positions (exit_time) WHERE closed
            """);
        execute(conn, """
            CREATE INDEX IF NOT EXISTS ix_trade_records_instrument_ts
                ON trade_records (instrument, ts)
            """);
        execute(conn, """
            CREATE INDEX IF NOT EXISTS ix_engine_events_instrument_ts
                ON engine_events (instrument, ts)
            """);
        execute(conn, """
            CREATE INDEX IF NOT EXISTS ix_order_queue_unclaimed
                ON order_queue (created_at) WHERE claimed_batch IS NULL
            """);
        execute(conn, """
            CREATE INDEX IF NOT EXISTS ix_decisions_actionable
                ON decisions (ts) WHERE decision <> 'HOLD'
            """);
    }

    static Map<String, String> tables() {
        Map<String, String> tables = new LinkedHashMap<>();

        tables.put("signals", """
            CREATE TABLE signals (
                instrument VARCHAR(32) NOT NULL,
                timeframe VARCHAR(8) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,

                -- Normalized components
                technical DOUBLE PRECISION NOT NULL,
                forecast DOUBLE PRECISION NOT NULL,
                sentiment DOUBLE PRECISION NOT NULL,
                macro DOUBLE PRECISION NOT NULL,
                forecast_confidence DOUBLE PRECISION NOT NULL,

                -- Effective weights
                weight_technical DOUBLE PRECISION NOT NULL,
                weight_forecast DOUBLE PRECISION NOT NULL,
                weight_sentiment DOUBLE PRECISION NOT NULL,
                weight_macro DOUBLE PRECISION NOT NULL,

                macro_adjustment DOUBLE PRECISION NOT NULL,
                fused_score DOUBLE PRECISION NOT NULL,

                -- Thresholds in force
                buy_threshold DOUBLE PRECISION NOT NULL,
                sell_threshold DOUBLE PRECISION NOT NULL,
                volatility_ratio DOUBLE PRECISION NOT NULL,
                macro_adjusted BOOLEAN NOT NULL,

                decision VARCHAR(8) NOT NULL,
                low_confidence BOOLEAN NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),

                PRIMARY KEY (instrument, timeframe, ts)
            )
            """);

        tables.put("decisions", """
            CREATE TABLE decisions (
                instrument VARCHAR(32) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,
                score DOUBLE PRECISION NOT NULL,
                no_data BOOLEAN NOT NULL,
                agreement_ratio DOUBLE PRECISION NOT NULL,
                majority_direction INT NOT NULL,
                adjustment VARCHAR(16) NOT NULL,
                effective_weights JSONB NOT NULL,
                excluded_timeframes JSONB NOT NULL,
                buy_threshold DOUBLE PRECISION NOT NULL,
                sell_threshold DOUBLE PRECISION NOT NULL,
                volatility_ratio DOUBLE PRECISION NOT NULL,
                macro_adjusted BOOLEAN NOT NULL,
                decision VARCHAR(8) NOT NULL,
                reference_price NUMERIC(24,8),
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),

                PRIMARY KEY (instrument, ts)
            )
            """);

        tables.put("decision_outcomes", """
            CREATE TABLE decision_outcomes (
                instrument VARCHAR(32) NOT NULL,
                decision_time TIMESTAMPTZ NOT NULL,
                window_name VARCHAR(8) NOT NULL,
                decision VARCHAR(8) NOT NULL,
                entry_price NUMERIC(24,8) NOT NULL,
                exit_price NUMERIC(24,8) NOT NULL,
                price_change_pct DOUBLE PRECISION NOT NULL,
                max_favorable_pct DOUBLE PRECISION NOT NULL,
                max_adverse_pct DOUBLE PRECISION NOT NULL,
                label VARCHAR(8) NOT NULL,
                labeled_at TIMESTAMPTZ NOT NULL,

                PRIMARY KEY (instrument, decision_time, window_name)
            )
            """);

        tables.put("positions", """
            CREATE TABLE positions (
                position_id VARCHAR(64) PRIMARY KEY,
                instrument VARCHAR(32) NOT NULL,
                entry_price NUMERIC(24,8) NOT NULL,
                quantity NUMERIC(24,8) NOT NULL,
                entry_time TIMESTAMPTZ NOT NULL,

                -- Protective levels
                stop_loss NUMERIC(24,8) NOT NULL,
                take_profit NUMERIC(24,8) NOT NULL,
                peak_price NUMERIC(24,8) NOT NULL,

                -- Exit
                closed BOOLEAN NOT NULL DEFAULT FALSE,
                exit_price NUMERIC(24,8),
                exit_time TIMESTAMPTZ,
                exit_reason VARCHAR(20),

                entry_order_id VARCHAR(64),
                exit_order_id VARCHAR(64),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("trade_records", """
            CREATE TABLE trade_records (
                seq BIGSERIAL PRIMARY KEY,
                instrument VARCHAR(32) NOT NULL,
                action VARCHAR(8) NOT NULL,
                quantity NUMERIC(24,8) NOT NULL,
                price NUMERIC(24,8) NOT NULL,
                fee NUMERIC(24,8) NOT NULL DEFAULT 0,
                ts TIMESTAMPTZ NOT NULL,
                order_id VARCHAR(64),
                batch_id VARCHAR(64),
                score DOUBLE PRECISION,
                weights JSONB,
                fill_source VARCHAR(20) NOT NULL
            )
            """);

        tables.put("order_intents", """
            CREATE TABLE order_intents (
                intent_key VARCHAR(160) PRIMARY KEY,
                batch_id VARCHAR(64) NOT NULL,
                request_id VARCHAR(64) NOT NULL,
                instrument VARCHAR(32) NOT NULL,
                action VARCHAR(8) NOT NULL,
                status VARCHAR(16) NOT NULL,
                order_id VARCHAR(64),
                detail TEXT,
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("engine_events", """
            CREATE TABLE engine_events (
                seq BIGSERIAL PRIMARY KEY,
                event_type VARCHAR(40) NOT NULL,
                instrument VARCHAR(32),
                ts TIMESTAMPTZ NOT NULL,
                payload JSONB NOT NULL
            )
            """);

        tables.put("order_queue", """
            CREATE TABLE order_queue (
                request_id VARCHAR(64) PRIMARY KEY,
                instrument VARCHAR(32) NOT NULL,
                action VARCHAR(8) NOT NULL,
                score DOUBLE PRECISION NOT NULL,
                buy_threshold DOUBLE PRECISION,
                exit_reason VARCHAR(20),
                forced BOOLEAN NOT NULL DEFAULT FALSE,
                weights JSONB,
                created_at TIMESTAMPTZ NOT NULL,
                claimed_batch VARCHAR(64),
                claimed_at TIMESTAMPTZ
            )
            """);

        tables.put("candles", """
            CREATE TABLE candles (
                instrument VARCHAR(32) NOT NULL,
                timeframe VARCHAR(8) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,
                open NUMERIC(24,8) NOT NULL,
                high NUMERIC(24,8) NOT NULL,
                low NUMERIC(24,8) NOT NULL,
                close NUMERIC(24,8) NOT NULL,
                volume NUMERIC(28,8) NOT NULL,

                PRIMARY KEY (instrument, timeframe, ts)
            )
            """);

        tables.put("technical_scores", """
            CREATE TABLE technical_scores (
                instrument VARCHAR(32) NOT NULL,
                timeframe VARCHAR(8) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,
                score DOUBLE PRECISION NOT NULL,
                band_width DOUBLE PRECISION NOT NULL DEFAULT 0,
                indicators JSONB,

                PRIMARY KEY (instrument, timeframe, ts)
            )
            """);

        tables.put("sentiment_scores", """
            CREATE TABLE sentiment_scores (
                instrument VARCHAR(32) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,
                score DOUBLE PRECISION NOT NULL,
                headlines JSONB,

                PRIMARY KEY (instrument, ts)
            )
            """);

        tables.put("market_context", """
            CREATE TABLE market_context (
                ts TIMESTAMPTZ PRIMARY KEY,
                score DOUBLE PRECISION NOT NULL,
                fear_greed_index INT NOT NULL,
                btc_dominance DOUBLE PRECISION,
                labels JSONB
            )
            """);

        return tables;
    }
}
