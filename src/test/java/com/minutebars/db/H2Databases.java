package com.minutebars.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.UUID;

/**
 * In-memory H2 databases in PostgreSQL mode, one per call.
 */
public final class H2Databases {
    private H2Databases() {
    }

    public static String newUrl() {
        return "jdbc:h2:mem:bars_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    }

    public static Connection openMigrated(String url) throws SQLException {
        Connection connection = DriverManager.getConnection(url, "sa", "");
        new MigrationRunner().run(connection);
        return connection;
    }

    public static Connection openMigrated() throws SQLException {
        return openMigrated(newUrl());
    }
}
