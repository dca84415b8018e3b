package com.minutebars.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable run settings resolved once at start-up and handed to every component.
 */
public final class BackfillSettings {
    public static final List<String> DEFAULT_SYMBOLS = List.of(
            "AAPL", "MSFT", "GOOGL", "AMZN", "NVDA", "META", "TSLA", "BRK.B", "V", "UNH",
            "JNJ", "WMT", "JPM", "MA", "PG", "XOM", "HD", "CVX", "MRK", "ABBV",
            "KO", "PEP", "COST", "AVGO", "TMO", "MCD", "CSCO", "ACN", "ABT", "CRM",
            "NFLX", "AMD", "NKE", "DHR", "TXN", "ORCL", "QCOM", "DIS", "PM", "VZ",
            "INTC", "UPS", "HON", "NEE", "CMCSA", "AMGN", "T", "IBM", "BA", "GE"
    );

    public final String apiKey;
    public final String apiBaseUrl;
    public final Duration requestTimeout;
    public final DbSettings db;
    public final List<String> symbols;
    public final int initialBackfillDays;
    public final Duration interSymbolDelay;
    public final ZoneId marketZone;

    public BackfillSettings(
            String apiKey,
            String apiBaseUrl,
            Duration requestTimeout,
            DbSettings db,
            List<String> symbols,
            int initialBackfillDays,
            Duration interSymbolDelay,
            ZoneId marketZone
    ) {
        this.apiKey = apiKey;
        this.apiBaseUrl = apiBaseUrl;
        this.requestTimeout = requestTimeout;
        this.db = db;
        this.symbols = normalizeSymbols(symbols);
        this.initialBackfillDays = initialBackfillDays;
        this.interSymbolDelay = interSymbolDelay;
        this.marketZone = marketZone;
    }

    /**
     * Resolves and validates every option, reporting all missing required keys at once.
     */
    public static BackfillSettings from(Config config) {
        List<String> missing = new ArrayList<>();
        String apiKey = required(config, "fmp.api_key", missing);
        String host = required(config, "db.host", missing);
        String name = required(config, "db.name", missing);
        String user = required(config, "db.user", missing);
        String password = config.getRaw("db.password");
        if (password == null) {
            missing.add(describe("db.password"));
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + String.join(", ", missing));
        }

        int port = config.getInt("db.port", -1);
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid db.port: " + config.getString("db.port"));
        }
        int initialDays = config.getInt("backfill.initial_days", -1);
        if (initialDays < 0) {
            throw new IllegalArgumentException("invalid backfill.initial_days: " + config.getString("backfill.initial_days"));
        }
        long delayMs = config.getLong("backfill.inter_symbol_delay_ms", -1L);
        if (delayMs < 0) {
            throw new IllegalArgumentException("invalid backfill.inter_symbol_delay_ms: "
                    + config.getString("backfill.inter_symbol_delay_ms"));
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(config.getString("backfill.market_zone"));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid backfill.market_zone: " + config.getString("backfill.market_zone"), e);
        }
        List<String> symbols = config.getList("backfill.symbols");
        if (normalizeSymbols(symbols).isEmpty()) {
            throw new IllegalArgumentException("backfill.symbols must name at least one symbol");
        }

        DbSettings db = new DbSettings(
                host,
                port,
                name,
                user,
                password,
                config.getBoolean("db.sql_log.enabled", false),
                config.getInt("db.insert_chunk_size", 500)
        );
        return new BackfillSettings(
                apiKey,
                config.getString("fmp.base_url"),
                Duration.ofSeconds(Math.max(1, config.getInt("fmp.request_timeout_sec", 10))),
                db,
                symbols,
                initialDays,
                Duration.ofMillis(delayMs),
                zone
        );
    }

    public String maskedApiKey() {
        if (apiKey == null || apiKey.length() <= 4) {
            return "***";
        }
        return apiKey.substring(0, 2) + "***" + apiKey.substring(apiKey.length() - 2);
    }

    @Override
    public String toString() {
        return "symbols=" + symbols.size()
                + " initial_days=" + initialBackfillDays
                + " delay_ms=" + interSymbolDelay.toMillis()
                + " zone=" + marketZone
                + " api=" + apiBaseUrl
                + " api_key=" + maskedApiKey()
                + " db=" + db.jdbcUrl();
    }

    static List<String> normalizeSymbols(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String symbol : raw) {
            if (symbol == null) {
                continue;
            }
            String normalized = symbol.trim().toUpperCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                seen.add(normalized);
            }
        }
        return List.copyOf(seen);
    }

    private static String required(Config config, String key, List<String> missing) {
        String value = config.getString(key);
        if (value.isEmpty()) {
            missing.add(describe(key));
        }
        return value;
    }

    private static String describe(String key) {
        String env = Config.envNameOf(key);
        return env == null ? key : key + " (" + env + ")";
    }
}
