package com.minutebars.db;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void runTwiceShouldKeepSchemaAndData() throws Exception {
        String url = H2Databases.newUrl();
        try (Connection conn = DriverManager.getConnection(url, "sa", "")) {
            MigrationRunner runner = new MigrationRunner();
            runner.run(conn);
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("INSERT INTO market_data(symbol, bar_time, trade_date, close_price, volume) "
                        + "VALUES('AAPL', TIMESTAMP WITH TIME ZONE '2024-03-14 10:00:00-04:00', DATE '2024-03-14', 170.5, 1000)");
            }

            runner.run(conn);

            assertEquals(1L, scalarLong(conn, "SELECT COUNT(*) FROM market_data"));
            assertEquals("1", scalarString(conn, "SELECT meta_value FROM backfill_metadata WHERE meta_key='schema_version'"));
            assertEquals(1L, scalarLong(conn, "SELECT COUNT(*) FROM backfill_metadata"));
        }
    }

    @Test
    void uniqueKeyShouldRejectSecondRowForSameSymbolAndTime() throws Exception {
        try (Connection conn = H2Databases.openMigrated(); Statement st = conn.createStatement()) {
            String insert = "INSERT INTO market_data(symbol, bar_time, trade_date, close_price, volume) "
                    + "VALUES('AAPL', TIMESTAMP WITH TIME ZONE '2024-03-14 10:00:00-04:00', DATE '2024-03-14', 170.5, 1000)";
            st.executeUpdate(insert);

            boolean rejected = false;
            try {
                st.executeUpdate(insert);
            } catch (SQLException e) {
                rejected = true;
            }
            assertTrue(rejected);
            assertEquals(1L, scalarLong(conn, "SELECT COUNT(*) FROM market_data"));
        }
    }

    private static long scalarLong(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static String scalarString(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getString(1);
        }
    }
}
