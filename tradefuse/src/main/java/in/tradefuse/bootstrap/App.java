package in.tradefuse.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.tradefuse.application.monitoring.AlertService;
import in.tradefuse.application.port.input.InvocationContext;
import in.tradefuse.application.port.output.EngineEventRepository;
import in.tradefuse.application.port.output.NotificationChannel;
import in.tradefuse.application.port.output.PositionRepository;
import in.tradefuse.application.port.output.SignalRepository;
import in.tradefuse.config.EngineConfig;
import in.tradefuse.config.EngineConfigService;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.domain.order.BatchResult;
import in.tradefuse.domain.order.ExecutionStatus;
import in.tradefuse.domain.order.OrderBatch;
import in.tradefuse.infrastructure.exchange.CoincheckExchangeClient;
import in.tradefuse.infrastructure.forecast.HttpForecastModel;
import in.tradefuse.infrastructure.metrics.MetricsTextfileWriter;
import in.tradefuse.infrastructure.metrics.PrometheusEngineMetrics;
import in.tradefuse.infrastructure.notification.SlackNotificationChannel;
import in.tradefuse.infrastructure.persistence.PostgresCandleFeed;
import in.tradefuse.infrastructure.persistence.PostgresEngineEventRepository;
import in.tradefuse.infrastructure.persistence.PostgresMacroContextService;
import in.tradefuse.infrastructure.persistence.PostgresOrderIntentRepository;
import in.tradefuse.infrastructure.persistence.PostgresPositionRepository;
import in.tradefuse.infrastructure.persistence.PostgresSentimentService;
import in.tradefuse.infrastructure.persistence.PostgresSignalOutcomeRepository;
import in.tradefuse.infrastructure.persistence.PostgresSignalRepository;
import in.tradefuse.infrastructure.persistence.PostgresTechnicalIndicatorService;
import in.tradefuse.infrastructure.persistence.PostgresTradeBookkeeping;
import in.tradefuse.infrastructure.persistence.PostgresTradeRecordRepository;
import in.tradefuse.infrastructure.queue.PostgresOrderQueue;
import in.tradefuse.infrastructure.retry.BoundedRetry;
import in.tradefuse.infrastructure.retry.RetryPolicy;
import in.tradefuse.infrastructure.retry.Sleeper;
import in.tradefuse.migration.EngineSchemaMigration;
import in.tradefuse.service.execution.FillReconciler;
import in.tradefuse.service.execution.FillSanityGuard;
import in.tradefuse.service.execution.OrderExecutionService;
import in.tradefuse.service.exit.MonitorReport;
import in.tradefuse.service.exit.TrailingStopEngine;
import in.tradefuse.service.outcome.LabelingReport;
import in.tradefuse.service.outcome.SignalOutcomeLabeler;
import in.tradefuse.service.risk.CircuitBreaker;
import in.tradefuse.service.signal.ScoringOutcome;
import in.tradefuse.service.signal.ScoringService;
import in.tradefuse.service.sizing.KellyPositionSizer;
import in.tradefuse.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Process entry point (NO framework).
 *
 * Each invocation performs exactly one unit of work selected by RUN_MODE, then exports
 * metrics and exits. Scheduling and triggering are external.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TradeFuse Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RunMode mode = RunMode.parse(args.length > 0 ? args[0] : Env.get("RUN_MODE", null));
        boolean tradingEnabled = Env.getBool("TRADING_ENABLED", false);
        String accessKey = Env.get("EXCHANGE_ACCESS_KEY", null);
        String secretKey = Env.get("EXCHANGE_SECRET_KEY", null);
        Duration timeout = Duration.ofSeconds(Env.getLong("INVOCATION_TIMEOUT_SECONDS", 240));

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        String configPath = Env.get("ENGINE_CONFIG_PATH", null);
        EngineConfig config = new EngineConfigService(configPath == null ? null : Path.of(configPath)).load();
        StartupConfigValidator.validate(mode, config, tradingEnabled, accessKey, secretKey);

        Clock clock = Clock.systemUTC();
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        log.info("✓ Prometheus metrics initialized");

        int exitCode = 0;
        try (HikariDataSource dataSource = createDataSource()) {
            // ═══════════════════════════════════════════════════════════════
            // Schema Migration (runs on startup)
            // ═══════════════════════════════════════════════════════════════
            new EngineSchemaMigration(dataSource).migrate();

            // ═══════════════════════════════════════════════════════════════
            // Shared collaborators
            // ═══════════════════════════════════════════════════════════════
            EngineEventRepository eventRepo = new PostgresEngineEventRepository(dataSource);
            PositionRepository positionRepo = new PostgresPositionRepository(dataSource);
            SignalRepository signalRepo = new PostgresSignalRepository(dataSource);
            PostgresOrderQueue orderQueue = new PostgresOrderQueue(dataSource);
            NotificationChannel slack = new SlackNotificationChannel(Env.get("SLACK_WEBHOOK_URL", null));
            AlertService alertService = new AlertService(slack, eventRepo, metrics);
            BoundedRetry retry = new BoundedRetry(RetryPolicy::forExternalRead, Sleeper.system(), clock, metrics);
            CoincheckExchangeClient exchange = new CoincheckExchangeClient(
                Env.get("EXCHANGE_BASE_URL", CoincheckExchangeClient.DEFAULT_BASE_URL),
                accessKey == null ? "" : accessKey,
                secretKey == null ? "" : secretKey);

            InvocationContext ctx = InvocationContext.withTimeout(clock, timeout);
            log.info("[APP] Invocation {} mode={} deadline={}", ctx.invocationId(), mode, ctx.deadline());

            boolean ok = switch (mode) {
                case SCORE -> runScoring(ctx, config, dataSource, signalRepo, orderQueue, retry, metrics, alertService);
                case EXECUTE -> runExecution(ctx, config, dataSource, exchange, positionRepo, eventRepo,
                    orderQueue, retry, alertService, slack, metrics, clock);
                case MONITOR -> runMonitor(ctx, config, positionRepo, exchange, orderQueue, eventRepo,
                    alertService, retry, metrics);
                case LABEL -> runLabeling(ctx, config, dataSource, signalRepo);
            };
            exitCode = ok ? 0 : 1;
        } catch (RuntimeException e) {
            log.error("[APP] Invocation failed: {}", e.getMessage(), e);
            exitCode = 2;
        } finally {
            String textfile = Env.get("METRICS_TEXTFILE", null);
            if (textfile != null) {
                new MetricsTextfileWriter(metrics.getRegistry(), Path.of(textfile)).write();
            }
        }

        log.info("=== TradeFuse Engine finished (exit={}) ===", exitCode);
        System.exit(exitCode);
    }

    private static boolean runScoring(InvocationContext ctx, EngineConfig config, HikariDataSource dataSource,
                                      SignalRepository signalRepo, PostgresOrderQueue orderQueue,
                                      BoundedRetry retry, PrometheusEngineMetrics metrics, AlertService alertService) {
        ScoringService scoring = new ScoringService(
            config,
            new PostgresMacroContextService(dataSource),
            new PostgresSentimentService(dataSource),
            new PostgresTechnicalIndicatorService(dataSource),
            new PostgresCandleFeed(dataSource),
            new HttpForecastModel(Env.get("FORECAST_API_URL", "http://localhost:8080/predict"), Duration.ofSeconds(30)),
            signalRepo,
            orderQueue,
            retry,
            metrics,
            alertService);

        String only = Env.get("ENGINE_INSTRUMENT", null);
        List<String> symbols = only != null
            ? List.of(config.requireInstrument(only).symbol())
            : config.instruments().stream().map(InstrumentConfig::symbol).toList();

        boolean ok = true;
        for (String symbol : symbols) {
            ScoringOutcome outcome = scoring.tick(ctx, symbol);
            log.info("[APP] {} -> {} ({})", symbol, outcome.decisionOrHold(), outcome.status());
            if (outcome.status() == ScoringOutcome.Status.TIMED_OUT) {
                log.warn("[APP] Deadline reached, remaining instruments skipped");
                return false;
            }
            ok &= outcome.status() == ScoringOutcome.Status.OK;
        }
        return ok;
    }

    private static boolean runExecution(InvocationContext ctx, EngineConfig config, HikariDataSource dataSource,
                                        CoincheckExchangeClient exchange, PositionRepository positionRepo,
                                        EngineEventRepository eventRepo, PostgresOrderQueue orderQueue,
                                        BoundedRetry retry, AlertService alertService, NotificationChannel slack,
                                        PrometheusEngineMetrics metrics, Clock clock) {
        PostgresTradeRecordRepository tradeRepo = new PostgresTradeRecordRepository(dataSource);
        CircuitBreaker breaker = new CircuitBreaker(config.circuitBreaker(), positionRepo, eventRepo,
            alertService, metrics, clock);
        OrderExecutionService execution = new OrderExecutionService(
            config,
            exchange,
            positionRepo,
            new PostgresTradeBookkeeping(dataSource),
            new PostgresOrderIntentRepository(dataSource),
            eventRepo,
            breaker,
            new KellyPositionSizer(config.sizing(), tradeRepo),
            new FillReconciler(config.execution(), exchange, exchange, Sleeper.system(), alertService),
            new FillSanityGuard(config.execution(), exchange, retry, alertService, eventRepo, metrics),
            retry,
            alertService,
            slack,
            metrics);

        Optional<OrderBatch> batch = orderQueue.claimBatch(config.execution().batchSize());
        if (batch.isEmpty()) {
            log.info("[APP] Order queue empty");
            return true;
        }
        BatchResult result = execution.consume(ctx, batch.get());
        log.info("[APP] Batch {}: filled={} skipped={} vetoed={} failed={}",
            result.batchId(),
            result.count(ExecutionStatus.FILLED),
            result.count(ExecutionStatus.SKIPPED),
            result.count(ExecutionStatus.VETOED),
            result.count(ExecutionStatus.FAILED));
        return !result.hasFailures();
    }

    private static boolean runMonitor(InvocationContext ctx, EngineConfig config, PositionRepository positionRepo,
                                      CoincheckExchangeClient exchange, PostgresOrderQueue orderQueue,
                                      EngineEventRepository eventRepo, AlertService alertService,
                                      BoundedRetry retry, PrometheusEngineMetrics metrics) {
        TrailingStopEngine engine = new TrailingStopEngine(config, positionRepo, exchange, orderQueue,
            eventRepo, alertService, retry, metrics);
        MonitorReport report = engine.tick(ctx);
        log.info("[APP] Monitor: {}", report);
        return !report.hasFailures() && !report.timedOut();
    }

    private static boolean runLabeling(InvocationContext ctx, EngineConfig config, HikariDataSource dataSource,
                                       SignalRepository signalRepo) {
        SignalOutcomeLabeler labeler = new SignalOutcomeLabeler(config.outcome(), signalRepo,
            new PostgresSignalOutcomeRepository(dataSource), new PostgresCandleFeed(dataSource));
        LabelingReport report = labeler.run(ctx);
        log.info("[APP] Labeling: {}", report);
        return report.failures() == 0;
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/tradefuse");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 4);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("tradefuse-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {
    }
}
