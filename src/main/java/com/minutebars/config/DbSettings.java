package com.minutebars.config;

/**
 * PostgreSQL connection parameters.
 */
public final class DbSettings {
    public final String host;
    public final int port;
    public final String name;
    public final String user;
    public final String password;
    public final boolean sqlLogEnabled;
    public final int insertChunkSize;

    public DbSettings(
            String host,
            int port,
            String name,
            String user,
            String password,
            boolean sqlLogEnabled,
            int insertChunkSize
    ) {
        this.host = host;
        this.port = port;
        this.name = name;
        this.user = user;
        this.password = password == null ? "" : password;
        this.sqlLogEnabled = sqlLogEnabled;
        this.insertChunkSize = Math.max(1, insertChunkSize);
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    @Override
    public String toString() {
        return "DbSettings{url=" + jdbcUrl() + ", user=" + user + ", password=***}";
    }
}
