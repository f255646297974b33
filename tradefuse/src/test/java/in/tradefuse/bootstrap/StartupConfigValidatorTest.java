package in.tradefuse.bootstrap;

import in.tradefuse.config.EngineConfig;
import in.tradefuse.config.InstrumentConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private final EngineConfig config = EngineConfig.defaults();

    @Test
    void executeRequiresTradingEnabled() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(RunMode.EXECUTE, config, false, "key", "secret"));
        assertTrue(e.getMessage().contains("TRADING_ENABLED"));
    }

    @Test
    void executeRequiresCredentials() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(RunMode.EXECUTE, config, true, "key", " "));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(RunMode.EXECUTE, config, true, null, "secret"));
    }

    @Test
    void executeWithTradingAndCredentialsPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(RunMode.EXECUTE, config, true, "key", "secret"));
    }

    @Test
    void otherModesRunWithTradingDisabled() {
        for (RunMode mode : List.of(RunMode.SCORE, RunMode.MONITOR, RunMode.LABEL)) {
            assertDoesNotThrow(() -> StartupConfigValidator.validate(mode, config, false, null, null));
        }
    }

    @Test
    void rejectsTwoReferenceInstruments() {
        EngineConfig twoReferences = new EngineConfig(config.version(), config.fusion(), config.timeframes(),
            config.thresholds(), config.sizing(), config.circuitBreaker(), config.trailingStop(),
            config.execution(), config.outcome(),
            List.of(InstrumentConfig.of("btc", "jpy", "0.001", 8, 0.030, true),
                InstrumentConfig.of("eth", "jpy", "0.001", 8, 0.040, true)));

        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(RunMode.SCORE, twoReferences, false, null, null));
    }
}
