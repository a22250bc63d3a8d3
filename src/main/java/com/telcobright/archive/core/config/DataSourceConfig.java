package com.telcobright.archive.core.config;

import java.util.Properties;

/**
 * Connection settings of the archive database, used to build the HikariCP
 * pool behind {@link com.telcobright.archive.db.connection.ConnectionProvider}.
 */
public class DataSourceConfig {
    private static final int DEFAULT_PORT = 5432;
    private static final int DEFAULT_POOL_SIZE = 4;

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final int maximumPoolSize;

    private DataSourceConfig(String host, int port, String database, String username, String password,
                             int maximumPoolSize) {
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
        this.maximumPoolSize = maximumPoolSize;
    }

    /**
     * Connect as postgres with an empty password.
     */
    public static DataSourceConfig create(String host, int port, String database) {
        return create(host, port, database, "postgres", "");
    }

    public static DataSourceConfig create(String host, int port, String database, String username, String password) {
        return create(host, port, database, username, password, DEFAULT_POOL_SIZE);
    }

    public static DataSourceConfig create(String host, int port, String database, String username, String password,
                                          int maximumPoolSize) {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (database == null || database.trim().isEmpty()) {
            throw new IllegalArgumentException("Database cannot be null or empty");
        }
        if (maximumPoolSize < 2) {
            // One connection is pinned by the maintenance lock while DDL runs on another
            throw new IllegalArgumentException("Pool size must be at least 2");
        }
        if (username == null) {
            username = "postgres";
        }
        if (password == null) {
            password = "";
        }
        return new DataSourceConfig(host, port, database, username, password, maximumPoolSize);
    }

    /**
     * Read archive.db.* keys: host, port, name, user, password, pool-size.
     */
    public static DataSourceConfig fromProperties(Properties properties) {
        return create(
            properties.getProperty("archive.db.host", "localhost"),
            Integer.parseInt(properties.getProperty("archive.db.port", String.valueOf(DEFAULT_PORT))),
            properties.getProperty("archive.db.name"),
            properties.getProperty("archive.db.user"),
            properties.getProperty("archive.db.password"),
            Integer.parseInt(properties.getProperty("archive.db.pool-size", String.valueOf(DEFAULT_POOL_SIZE))));
    }

    public String getJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }

    @Override
    public String toString() {
        return String.format("DataSource[%s:%d/%s]", host, port, database);
    }
}
