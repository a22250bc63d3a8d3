package com.telcobright.archive.db.connection;

import com.telcobright.archive.core.config.DataSourceConfig;
import com.telcobright.archive.core.exception.MaintenanceInProgressException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pooled connection provider with a maintenance locking mechanism.
 *
 * Maintenance runs on the same lock key exclude each other, both inside this
 * process and across processes sharing the database (through a
 * session-level PostgreSQL advisory lock). Runs on different keys proceed in
 * parallel. Ordinary connections are never blocked by maintenance.
 */
public class ConnectionProvider {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProvider.class);
    
    private static final String TRY_ADVISORY_LOCK = "SELECT pg_try_advisory_lock(hashtext(?))";
    private static final String ADVISORY_UNLOCK = "SELECT pg_advisory_unlock(hashtext(?))";
    
    private final DataSource dataSource;
    private final boolean ownsDataSource;
    
    /** Lock key to reason, for every maintenance lock held in this process */
    private final Map<String, String> activeMaintenance = new ConcurrentHashMap<>();
    
    /**
     * Create a provider backed by a new HikariCP pool
     */
    public ConnectionProvider(DataSourceConfig config) {
        this(createDataSource(config), true);
        logger.info("ConnectionProvider initialized for: {}", config);
    }
    
    /**
     * Wrap an externally managed data source; shutdown() leaves it open
     */
    public ConnectionProvider(DataSource dataSource) {
        this(dataSource, false);
    }
    
    private ConnectionProvider(DataSource dataSource, boolean ownsDataSource) {
        this.dataSource = dataSource;
        this.ownsDataSource = ownsDataSource;
    }
    
    private static HikariDataSource createDataSource(DataSourceConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setPoolName("archive-partitions");
        return new HikariDataSource(hikari);
    }
    
    public DataSource getDataSource() {
        return dataSource;
    }
    
    /**
     * Get a connection for normal operations. Never blocked by maintenance.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }
    
    /**
     * Acquire exclusive maintenance access for a lock key (typically the
     * schema-qualified parent table).
     *
     * @param lockKey key shared by every process maintaining the same table
     * @param reason description of the maintenance operation
     * @return a lock that must be closed to release maintenance access
     * @throws MaintenanceInProgressException if another run holds the lock
     */
    public MaintenanceLock acquireMaintenanceLock(String lockKey, String reason) throws SQLException {
        String running = activeMaintenance.putIfAbsent(lockKey, reason);
        if (running != null) {
            throw new MaintenanceInProgressException(
                "Maintenance of '" + lockKey + "' already running in this process: " + running);
        }
        
        Connection lockConnection = null;
        try {
            lockConnection = dataSource.getConnection();
            if (!tryAdvisoryLock(lockConnection, lockKey)) {
                throw new MaintenanceInProgressException(
                    "Maintenance lock '" + lockKey + "' is held by another session");
            }
        } catch (SQLException | RuntimeException e) {
            closeQuietly(lockConnection);
            activeMaintenance.remove(lockKey);
            throw e;
        }
        
        logger.info("Acquired maintenance lock '{}' for: {}", lockKey, reason);
        return new AdvisoryMaintenanceLock(lockConnection, lockKey);
    }
    
    private boolean tryAdvisoryLock(Connection connection, String lockKey) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(TRY_ADVISORY_LOCK)) {
            stmt.setString(1, lockKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
    
    private void releaseMaintenanceLock(Connection connection, String lockKey) {
        boolean unlocked = false;
        try (PreparedStatement stmt = connection.prepareStatement(ADVISORY_UNLOCK)) {
            stmt.setString(1, lockKey);
            stmt.executeQuery().close();
            unlocked = true;
        } catch (SQLException e) {
            logger.warn("Error releasing advisory lock '{}': {}", lockKey, e.getMessage());
        } finally {
            if (unlocked) {
                closeQuietly(connection);
            } else {
                discard(connection);
            }
            activeMaintenance.remove(lockKey);
            logger.info("Maintenance lock '{}' released", lockKey);
        }
    }
    
    /**
     * A pooled connection outlives close(), and so would its advisory lock.
     * Evict it from the pool so the session ends and the lock goes with it.
     */
    private void discard(Connection connection) {
        if (dataSource instanceof HikariDataSource) {
            ((HikariDataSource) dataSource).evictConnection(connection);
        } else {
            // Unpooled: closing ends the session
            closeQuietly(connection);
        }
    }
    
    private void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Error closing maintenance connection: {}", e.getMessage());
        }
    }
    
    /**
     * Check if any maintenance is currently in progress in this process
     */
    public boolean isMaintenanceInProgress() {
        return !activeMaintenance.isEmpty();
    }
    
    public boolean isMaintenanceInProgress(String lockKey) {
        return activeMaintenance.containsKey(lockKey);
    }
    
    /**
     * Reasons of the maintenance runs in progress, empty if none
     */
    public String getMaintenanceReason() {
        return String.join(", ", activeMaintenance.values());
    }
    
    /**
     * Shutdown the connection provider, closing the pool if it was created here
     */
    public void shutdown() {
        if (ownsDataSource && dataSource instanceof HikariDataSource) {
            ((HikariDataSource) dataSource).close();
        }
        logger.info("ConnectionProvider shutdown");
    }
    
    private class AdvisoryMaintenanceLock implements MaintenanceLock {
        private final Connection connection;
        private final String lockKey;
        private boolean closed = false;
        
        AdvisoryMaintenanceLock(Connection connection, String lockKey) {
            this.connection = connection;
            this.lockKey = lockKey;
        }
        
        @Override
        public void close() {
            if (!closed) {
                closed = true;
                releaseMaintenanceLock(connection, lockKey);
            }
        }
    }
}
