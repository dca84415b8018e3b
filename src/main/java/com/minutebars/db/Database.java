package com.minutebars.db;

import com.minutebars.config.DbSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Database connection manager backed by PostgreSQL.
 */
public final class Database {
    private static final Logger log = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final boolean sqlLogEnabled;

    public Database(DbSettings settings) {
        if (settings == null || isBlank(settings.host) || isBlank(settings.name)) {
            throw new IllegalArgumentException("db.host and db.name must not be empty");
        }
        this.jdbcUrl = settings.jdbcUrl();
        this.sqlLogEnabled = settings.sqlLogEnabled;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setServerNames(new String[]{settings.host.trim()});
        pg.setPortNumbers(new int[]{settings.port});
        pg.setDatabaseName(settings.name.trim());
        if (!isBlank(settings.user)) {
            pg.setUser(settings.user.trim());
        }
        pg.setPassword(settings.password);
        pg.setApplicationName("minutebars");
        this.dataSource = pg;
    }

    public Database(DataSource dataSource, String jdbcUrl, boolean sqlLogEnabled) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
        this.jdbcUrl = jdbcUrl == null ? "" : jdbcUrl.trim();
        this.sqlLogEnabled = sqlLogEnabled;
    }

    /**
     * Opens a new connection. Failures are rethrown with the masked URL and a short hint.
     */
    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            log.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&;]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    static String classifyConnectFailure(SQLException e) {
        String state = e == null || e.getSQLState() == null ? "" : e.getSQLState();
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (state.startsWith("28") || msg.contains("password authentication failed")) {
            return "auth";
        }
        if ("3D000".equals(state) || (msg.contains("database") && msg.contains("does not exist"))) {
            return "missing_database";
        }
        if (state.startsWith("08") || msg.contains("connection refused") || msg.contains("unknownhost")) {
            return "unreachable";
        }
        return "connection_error";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
