package com.telcobright.archive.db.catalog;

import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;
import com.telcobright.archive.core.routing.DispatchRoutine;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Store capabilities partition maintenance relies on: introspection of
 * bucket tables and hooks, transactional bucket creation and atomic
 * replacement of the dispatch routine.
 */
public interface PartitionCatalog {

    /**
     * Verify the owner role, the parent table and every lookup relation a
     * bucket foreign key references exist.
     *
     * @throws com.telcobright.archive.core.exception.ConfigurationException if one is missing
     */
    void verifyPrerequisites(String schema, String owner) throws SQLException;

    boolean bucketExists(String schema, Bucket bucket) throws SQLException;

    /**
     * Create the bucket table with its check constraint, owner, index and
     * foreign keys. Either all of them are created or none.
     */
    void createBucket(String schema, String owner, Bucket bucket) throws SQLException;

    /**
     * Every physical bucket of the given granularity attached to the parent table, oldest first.
     */
    List<Bucket> listBuckets(String schema, Granularity granularity) throws SQLException;

    /**
     * Version comment of the installed dispatch routine, empty if none is installed.
     */
    Optional<String> installedRoutineComment(String schema) throws SQLException;

    boolean insertHookExists(String schema) throws SQLException;

    /**
     * Replace the dispatch routine and record its version; install the
     * insert hook when it is missing. All or nothing.
     *
     * @return true if the hook was installed by this call
     */
    boolean replaceRoutine(String schema, DispatchRoutine routine) throws SQLException;
}
