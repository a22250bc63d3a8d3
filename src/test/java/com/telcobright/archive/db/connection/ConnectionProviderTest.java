package com.telcobright.archive.db.connection;

import com.telcobright.archive.core.exception.MaintenanceInProgressException;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConnectionProvider focusing on maintenance locking
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ConnectionProvider Tests")
class ConnectionProviderTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection lockConnection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private ConnectionProvider connectionProvider;

    @BeforeEach
    void setUp() {
        connectionProvider = new ConnectionProvider(dataSource);
    }

    private void stubAdvisoryLock(Boolean first, Boolean... rest) throws SQLException {
        when(dataSource.getConnection()).thenReturn(lockConnection);
        when(lockConnection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean(1)).thenReturn(first, rest);
    }

    @Test
    @DisplayName("Should initially not be in maintenance mode")
    void testInitialMaintenanceState() {
        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();
        assertThat(connectionProvider.getMaintenanceReason()).isEmpty();
        assertThat(connectionProvider.getDataSource()).isSameAs(dataSource);
    }

    @Test
    @DisplayName("Should hold the advisory lock until the maintenance lock is closed")
    void testLockLifecycle() throws SQLException {
        // Given
        stubAdvisoryLock(true);

        // When
        MaintenanceLock lock = connectionProvider.acquireMaintenanceLock("archive.sample", "update month partitions");

        // Then
        assertThat(connectionProvider.isMaintenanceInProgress()).isTrue();
        assertThat(connectionProvider.getMaintenanceReason()).isEqualTo("update month partitions");
        verify(lockConnection).prepareStatement("SELECT pg_try_advisory_lock(hashtext(?))");
        verify(statement).setString(1, "archive.sample");
        verify(lockConnection, never()).close();

        lock.close();
        lock.close();

        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();
        verify(lockConnection).prepareStatement("SELECT pg_advisory_unlock(hashtext(?))");
        verify(lockConnection, times(1)).close();
    }

    @Test
    @DisplayName("Should reject a second run in the same process while the lock is held")
    void testReentryRejected() throws SQLException {
        stubAdvisoryLock(true, true);

        try (MaintenanceLock ignored = connectionProvider.acquireMaintenanceLock("archive.sample", "first")) {
            assertThatThrownBy(() -> connectionProvider.acquireMaintenanceLock("archive.sample", "second"))
                .isInstanceOf(MaintenanceInProgressException.class)
                .hasMessageContaining("first");
        }
        verify(dataSource, times(1)).getConnection();

        try (MaintenanceLock again = connectionProvider.acquireMaintenanceLock("archive.sample", "third")) {
            assertThat(connectionProvider.getMaintenanceReason()).isEqualTo("third");
        }
    }

    @Test
    @DisplayName("Should give up the connection when another session holds the lock")
    void testLockHeldElsewhere() throws SQLException {
        stubAdvisoryLock(false, true);

        assertThatThrownBy(() -> connectionProvider.acquireMaintenanceLock("archive.sample", "update"))
            .isInstanceOf(MaintenanceInProgressException.class)
            .hasMessageContaining("another session");

        verify(lockConnection).close();
        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();

        // The in-process claim was dropped
        try (MaintenanceLock lock = connectionProvider.acquireMaintenanceLock("archive.sample", "retry")) {
            assertThat(connectionProvider.isMaintenanceInProgress()).isTrue();
        }
    }

    @Test
    @DisplayName("Should drop the in-process claim when no connection can be obtained")
    void testConnectionFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        assertThatThrownBy(() -> connectionProvider.acquireMaintenanceLock("archive.sample", "update"))
            .isInstanceOf(SQLException.class)
            .hasMessageContaining("Connection refused");
        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();

        assertThatThrownBy(() -> connectionProvider.acquireMaintenanceLock("archive.sample", "update"))
            .isInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("Ordinary connections should not wait for maintenance")
    void testConnectionsDuringMaintenance() throws SQLException {
        stubAdvisoryLock(true);
        Connection other = mock(Connection.class);

        try (MaintenanceLock lock = connectionProvider.acquireMaintenanceLock("archive.sample", "update")) {
            when(dataSource.getConnection()).thenReturn(other);
            assertThat(connectionProvider.getConnection()).isSameAs(other);
        }
    }

    @Test
    @DisplayName("Should let runs on different tables hold their locks together")
    void testIndependentLockKeys() throws SQLException {
        stubAdvisoryLock(true, true);

        MaintenanceLock first = connectionProvider.acquireMaintenanceLock("archive.sample", "update archive");
        MaintenanceLock second = connectionProvider.acquireMaintenanceLock("staging.sample", "update staging");

        assertThat(connectionProvider.isMaintenanceInProgress("archive.sample")).isTrue();
        assertThat(connectionProvider.isMaintenanceInProgress("staging.sample")).isTrue();
        assertThat(connectionProvider.getMaintenanceReason())
            .contains("update archive")
            .contains("update staging");

        first.close();
        assertThat(connectionProvider.isMaintenanceInProgress("archive.sample")).isFalse();
        assertThat(connectionProvider.isMaintenanceInProgress()).isTrue();

        second.close();
        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();
        verify(dataSource, times(2)).getConnection();
    }

    @Test
    @DisplayName("Should evict the pooled connection when the advisory unlock fails")
    void testUnlockFailureEvictsConnection() throws SQLException {
        // Given
        HikariDataSource pool = mock(HikariDataSource.class);
        ConnectionProvider pooled = new ConnectionProvider(pool);
        when(pool.getConnection()).thenReturn(lockConnection);
        when(lockConnection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery())
            .thenReturn(resultSet)
            .thenThrow(new SQLException("terminating connection", "57P01"));
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean(1)).thenReturn(true);

        // When
        pooled.acquireMaintenanceLock("archive.sample", "update").close();

        // Then
        verify(pool).evictConnection(lockConnection);
        verify(lockConnection, never()).close();
        assertThat(pooled.isMaintenanceInProgress()).isFalse();
    }

    @Test
    @DisplayName("Should close an unpooled connection when the advisory unlock fails")
    void testUnlockFailureClosesUnpooledConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(lockConnection);
        when(lockConnection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery())
            .thenReturn(resultSet)
            .thenThrow(new SQLException("terminating connection", "57P01"));
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean(1)).thenReturn(true);

        connectionProvider.acquireMaintenanceLock("archive.sample", "update").close();

        verify(lockConnection).close();
        assertThat(connectionProvider.isMaintenanceInProgress()).isFalse();
    }
}
