package in.tradefuse.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the engine configuration.
 *
 * Lookup order: explicit file path, then the classpath resource, then built-in defaults.
 * A configuration that is present but invalid is refused rather than replaced by defaults.
 */
public final class EngineConfigService {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String CLASSPATH_RESOURCE = "engine-config.json";

    private final Path configFilePath;
    private final String classpathResource;

    public EngineConfigService(Path configFilePath) {
        this(configFilePath, CLASSPATH_RESOURCE);
    }

    public EngineConfigService(Path configFilePath, String classpathResource) {
        this.configFilePath = configFilePath;
        this.classpathResource = classpathResource;
    }

    /**
     * Load and validate the configuration.
     *
     * @return validated configuration, never null
     * @throws IllegalStateException if a configuration source exists but cannot be parsed or is invalid
     */
    public EngineConfig load() {
        EngineConfig config = readConfig();
        if (!config.isValid()) {
            log.error("Engine config version={} failed validation", config.version());
            throw new IllegalStateException("Invalid engine configuration: version=" + config.version());
        }
        log.info("✅ Engine config active: version={}, instruments={}",
            config.version(), config.instruments().size());
        return config;
    }

    private EngineConfig readConfig() {
        try {
            if (configFilePath != null && Files.exists(configFilePath)) {
                EngineConfig config = MAPPER.readValue(Files.readString(configFilePath), EngineConfig.class);
                log.info("✅ Loaded engine config from: {}", configFilePath);
                return config;
            }
            try (InputStream in = EngineConfigService.class.getClassLoader().getResourceAsStream(classpathResource)) {
                if (in != null) {
                    EngineConfig config = MAPPER.readValue(in, EngineConfig.class);
                    log.info("✅ Loaded engine config from classpath: {}", classpathResource);
                    return config;
                }
            }
            log.info("No engine config found, using defaults");
            return EngineConfig.defaults();
        } catch (IOException e) {
            log.error("Failed to read engine config: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to read engine configuration", e);
        }
    }

    /**
     * Serialize a configuration as pretty-printed JSON.
     */
    public static String toJson(EngineConfig config) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }
}
