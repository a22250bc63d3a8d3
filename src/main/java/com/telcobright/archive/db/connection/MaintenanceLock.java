package com.telcobright.archive.db.connection;

/**
 * Exclusive hold on partition maintenance for one parent table.
 * Closing it releases the hold.
 */
@FunctionalInterface
public interface MaintenanceLock extends AutoCloseable {

    @Override
    void close();
}
