package in.tradefuse.bootstrap;

import in.tradefuse.config.EngineConfig;
import in.tradefuse.config.InstrumentConfig;
import in.tradefuse.config.TrailingStopConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before anything touches the exchange. Throws IllegalStateException if the
 * configuration is unfit for the requested run mode, so the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration for one invocation.
     *
     * @param mode           Run mode of this invocation
     * @param config         Loaded engine configuration
     * @param tradingEnabled Value of TRADING_ENABLED
     * @param accessKey      Exchange access key (may be null)
     * @param secretKey      Exchange secret key (may be null)
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RunMode mode, EngineConfig config, boolean tradingEnabled,
                                String accessKey, String secretKey) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation (mode={}, config={})", mode, config.version());
        log.info("════════════════════════════════════════════════════════");

        long references = config.instruments().stream().filter(InstrumentConfig::reference).count();
        if (references > 1) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: at most one reference instrument allowed, found " + references);
        }

        for (TrailingStopConfig.TrailTier tier : config.trailingStop().unreachableTiers()) {
            log.warn("⚠️  Trail tier {}% ({}% trail) starts at or above take-profit {}% and never applies",
                tier.minGainPercent(), tier.trailPercent(), config.trailingStop().takeProfitPercent());
        }

        boolean hasCredentials = !isBlank(accessKey) && !isBlank(secretKey);

        if (mode == RunMode.EXECUTE) {
            if (!tradingEnabled) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: EXECUTE mode requires TRADING_ENABLED=true\n" +
                    "Orders would be claimed from the queue but never placed.\n" +
                    "Either:\n" +
                    "  1. Enable trading: set TRADING_ENABLED=true\n" +
                    "  2. Do not schedule EXECUTE invocations"
                );
            }
            if (!hasCredentials) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: EXECUTE mode requires EXCHANGE_ACCESS_KEY and EXCHANGE_SECRET_KEY");
            }
            log.info("✓ Live trading enabled with exchange credentials");
        } else {
            if (!tradingEnabled) {
                log.warn("⚠️  TRADING_ENABLED=false - decisions are recorded, orders are not executed");
            }
            if (mode == RunMode.MONITOR && !tradingEnabled) {
                log.warn("⚠️  MONITOR publishes forced exits that no EXECUTE run will consume");
            }
        }

        log.info("✅ Startup config validation passed");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
