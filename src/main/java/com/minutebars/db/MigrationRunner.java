package com.minutebars.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema setup for the bar store. Running it against an existing schema is a no-op.
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);

    public static final int SCHEMA_VERSION = 1;

    public void run(Connection conn) throws SQLException {
        int currentVersion = readSchemaVersion(conn);
        String lastSql = "";
        try (Statement st = conn.createStatement()) {
            for (String sql : buildStatements()) {
                lastSql = sql;
                st.execute(sql);
            }
            lastSql = "schema_version";
            writeSchemaVersion(conn, SCHEMA_VERSION);
            if (!conn.getAutoCommit()) {
                conn.commit();
            }
        } catch (SQLException e) {
            String detail = "migration_failed: schema_version=" + currentVersion
                    + ", target_version=" + SCHEMA_VERSION
                    + ", failed_sql=" + summarizeSql(lastSql)
                    + ", cause=" + safe(e.getMessage());
            log.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
        log.info("Schema verified: market_data (schema_version {} -> {})", currentVersion, SCHEMA_VERSION);
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS backfill_metadata (" +
                "meta_key VARCHAR(64) PRIMARY KEY," +
                "meta_value VARCHAR(255) NOT NULL," +
                "updated_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE TABLE IF NOT EXISTS market_data (" +
                "id BIGSERIAL PRIMARY KEY," +
                "symbol VARCHAR(10) NOT NULL," +
                "bar_time TIMESTAMP WITH TIME ZONE NOT NULL," +
                "trade_date DATE NOT NULL," +
                "open_price NUMERIC," +
                "high_price NUMERIC," +
                "low_price NUMERIC," +
                "close_price NUMERIC," +
                "volume BIGINT," +
                "created_at TIMESTAMP DEFAULT now()," +
                "CONSTRAINT uq_market_data_symbol_time UNIQUE (symbol, bar_time)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_market_data_symbol_date ON market_data(symbol, trade_date)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT meta_value FROM backfill_metadata WHERE meta_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            // First start: the metadata table does not exist yet.
            log.debug("schema_version unavailable: {}", e.getMessage());
            rollbackQuietly(conn);
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement update = conn.prepareStatement(
                "UPDATE backfill_metadata SET meta_value=?, updated_at=now() WHERE meta_key='schema_version'")) {
            update.setString(1, Integer.toString(version));
            if (update.executeUpdate() > 0) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO backfill_metadata(meta_key, meta_value) VALUES('schema_version', ?)")) {
            insert.setString(1, Integer.toString(version));
            insert.executeUpdate();
        }
    }

    private void rollbackQuietly(Connection conn) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            log.warn("rollback after schema_version probe failed: {}", e.getMessage());
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
