package com.minutebars.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 *
 * <p>Lookup order, highest first: explicit overrides (command line), environment variables,
 * the local {@code minutebars.properties} (or the file passed with {@code --config}),
 * the classpath {@code minutebars.properties}, then built-in defaults.
 */
public final class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    public static final String FILE_NAME = "minutebars.properties";

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_KEYS = buildEnvKeys();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties fileProps = new Properties();
    private final Properties envProps = new Properties();
    private final Properties overrideProps = new Properties();
    private Config() {
    }

    public static Config load(Path workingDir, Path explicitFile, Map<String, String> env) {
        Config config = new Config();

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            log.warn("failed to read classpath {}: {}", FILE_NAME, e.getMessage());
        }

        Path local = explicitFile != null ? explicitFile : workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.fileProps.load(in);
                config.props.putAll(config.fileProps);
            } catch (IOException e) {
                log.warn("failed to read {}: {}", local, e.getMessage());
            }
        } else if (explicitFile != null) {
            throw new IllegalArgumentException("config file not found: " + explicitFile);
        }

        if (env != null) {
            for (Map.Entry<String, String> entry : ENV_KEYS.entrySet()) {
                String value = env.get(entry.getValue());
                if (value != null) {
                    config.envProps.setProperty(entry.getKey(), value);
                    config.props.setProperty(entry.getKey(), value);
                }
            }
        }
        return config;
    }

    public static Config of(Map<String, String> values) {
        Config config = new Config();
        if (values != null) {
            values.forEach(config::override);
        }
        return config;
    }

    /**
     * Sets a value that wins over every other source.
     */
    public void override(String key, String value) {
        if (key == null || key.trim().isEmpty() || value == null) {
            return;
        }
        overrideProps.setProperty(key.trim(), value);
        props.setProperty(key.trim(), value);
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    /**
     * Raw value without trimming or defaulting; {@code null} when no source sets the key.
     */
    public String getRaw(String key) {
        return props.getProperty(key);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;\\s]+")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(envProps.getProperty(key)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(fileProps.getProperty(key)).isEmpty()) {
            return "file";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    public static String envNameOf(String key) {
        return ENV_KEYS.get(key);
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("fmp.base_url", "https://financialmodelingprep.com/api/v3");
        defaults.put("fmp.request_timeout_sec", "10");

        defaults.put("db.port", "5432");
        defaults.put("db.sql_log.enabled", "false");
        defaults.put("db.insert_chunk_size", "500");

        defaults.put("backfill.symbols", String.join(",", BackfillSettings.DEFAULT_SYMBOLS));
        defaults.put("backfill.initial_days", "30");
        defaults.put("backfill.inter_symbol_delay_ms", "500");
        defaults.put("backfill.market_zone", "America/New_York");

        return Collections.unmodifiableMap(defaults);
    }

    private static Map<String, String> buildEnvKeys() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("fmp.api_key", "FMP_API_KEY");
        env.put("fmp.base_url", "FMP_BASE_URL");
        env.put("db.host", "DB_HOST");
        env.put("db.port", "DB_PORT");
        env.put("db.name", "DB_NAME");
        env.put("db.user", "DB_USER");
        env.put("db.password", "DB_PASSWORD");
        env.put("backfill.symbols", "BACKFILL_SYMBOLS");
        return Collections.unmodifiableMap(env);
    }
}
