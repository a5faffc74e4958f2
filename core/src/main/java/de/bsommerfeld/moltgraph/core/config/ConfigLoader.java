package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.moltgraph.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Reads {@link GlobalConfig} from TOML and layers environment overrides on top.
 *
 * <h3>Resolution</h3>
 * <ol>
 * <li>Config file: {@code $MOLTGRAPH_CONFIG}, else {@code config.toml} in the
 * data directory. A missing file yields the defaults.</li>
 * <li>Data directory: {@code $MOLTGRAPH_HOME}, else the platform data
 * directory for {@value #APP_NAME}.</li>
 * <li>Environment: {@code MOLTBOOK_API_KEY}, {@code MOLTBOOK_BASE_URL},
 * {@code USER_AGENT}, {@code REQUESTS_PER_MINUTE}, {@code MOLTGRAPH_DB}
 * override whatever the file says.</li>
 * </ol>
 *
 * The environment is passed in as a map so tests never depend on the real
 * process environment.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String APP_NAME = "moltgraph";
    public static final String CONFIG_FILE = "config.toml";
    public static final String DEFAULT_DB_FILE = "moltgraph.db";

    private final Map<String, String> env;
    private final TomlMapper mapper;

    public ConfigLoader(Map<String, String> env) {
        this.env = env;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ConfigLoader fromSystemEnvironment() {
        return new ConfigLoader(System.getenv());
    }

    public Path dataDir() {
        String home = env.get("MOLTGRAPH_HOME");
        if (home != null && !home.isBlank()) {
            return Paths.get(home).toAbsolutePath();
        }
        return StorageUtils.getAppDataDir(APP_NAME);
    }

    public Path configPath() {
        String explicit = env.get("MOLTGRAPH_CONFIG");
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit).toAbsolutePath();
        }
        return dataDir().resolve(CONFIG_FILE);
    }

    public GlobalConfig load() {
        return load(configPath());
    }

    /**
     * Loads the given file (or defaults, if it does not exist) and applies the
     * environment overrides.
     *
     * @throws ConfigurationException if the file exists but cannot be parsed,
     *                                or an override is malformed
     */
    public GlobalConfig load(Path path) {
        GlobalConfig config;
        if (Files.exists(path)) {
            LOG.info("Loading configuration from: {}", path);
            try {
                config = mapper.readValue(path.toFile(), GlobalConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to parse configuration " + path, e);
            }
        } else {
            LOG.info("No configuration at {}, using defaults", path);
            config = new GlobalConfig();
        }
        applyEnvironment(config);
        return config;
    }

    void applyEnvironment(GlobalConfig config) {
        ApiConfig api = config.getApi();
        String apiKey = env.get("MOLTBOOK_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            api.setApiKey(apiKey.trim());
        }
        String baseUrl = env.get("MOLTBOOK_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            api.setBaseUrl(baseUrl.trim());
        }
        String userAgent = env.get("USER_AGENT");
        if (userAgent != null && !userAgent.isBlank()) {
            api.setUserAgent(userAgent.trim());
        }
        String rpm = env.get("REQUESTS_PER_MINUTE");
        if (rpm != null && !rpm.isBlank()) {
            try {
                api.setRequestsPerMinute(Integer.parseInt(rpm.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("REQUESTS_PER_MINUTE is not a number: " + rpm, e);
            }
        }
        String db = env.get("MOLTGRAPH_DB");
        if (db != null && !db.isBlank()) {
            config.getDatabase().setPath(db.trim());
        }
    }

    /**
     * Resolves the SQLite file: an absolute configured path is used as-is, a
     * relative one is resolved against the data directory, an empty one falls
     * back to {@value #DEFAULT_DB_FILE}.
     */
    public Path databasePath(GlobalConfig config) {
        String configured = config.getDatabase().getPath();
        if (configured == null || configured.isBlank()) {
            return dataDir().resolve(DEFAULT_DB_FILE);
        }
        Path path = Paths.get(configured);
        return path.isAbsolute() ? path : dataDir().resolve(path);
    }

    /**
     * Checks the values no stage can run without.
     *
     * @throws ConfigurationException on a missing API key or a non-positive
     *                                request budget
     */
    public static void validate(GlobalConfig config) {
        ApiConfig api = config.getApi();
        if (api.getApiKey() == null || api.getApiKey().isBlank()) {
            throw new ConfigurationException(
                    "No API key configured. Set MOLTBOOK_API_KEY or api.api-key in " + CONFIG_FILE);
        }
        if (api.getRequestsPerMinute() <= 0) {
            throw new ConfigurationException("requests-per-minute must be positive, was "
                    + api.getRequestsPerMinute());
        }
        if (api.getBaseUrl() == null || api.getBaseUrl().isBlank()) {
            throw new ConfigurationException("api.base-url must not be empty");
        }
    }
}
