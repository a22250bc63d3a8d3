package com.telcobright.archive.core.metadata;

import java.util.List;

/**
 * Fixed column contract of the archive sample table.
 *
 * Upstream writers and downstream readers depend on this exact column
 * list; every bucket table inherits it from the parent.
 */
public final class SampleTableMetadata {
    
    public static final String TABLE_NAME = "sample";
    public static final String TIME_COLUMN = "smpl_time";
    
    public static final String ROUTINE_NAME = "sample_insert_trigger_function";
    public static final String TRIGGER_NAME = "sample_insert_trigger";
    
    private static final List<ColumnMetadata> COLUMNS = List.of(
        new ColumnMetadata("channel_id", "BIGINT", false),
        new ColumnMetadata(TIME_COLUMN, "TIMESTAMP", false),
        new ColumnMetadata("nanosecs", "BIGINT", false),
        new ColumnMetadata("severity_id", "BIGINT", false),
        new ColumnMetadata("status_id", "BIGINT", false),
        new ColumnMetadata("num_val", "INT", true),
        new ColumnMetadata("float_val", "REAL", true),
        new ColumnMetadata("str_val", "VARCHAR(120)", true),
        new ColumnMetadata("datatype", "CHAR(1)", true, "' '"),
        new ColumnMetadata("array_val", "BYTEA", true)
    );
    
    private static final List<String> INDEX_COLUMNS = List.of("channel_id", TIME_COLUMN, "nanosecs");
    
    private static final List<ForeignKeyMetadata> FOREIGN_KEYS = List.of(
        new ForeignKeyMetadata("channel_id", "channel", "channel_id"),
        new ForeignKeyMetadata("severity_id", "severity", "severity_id"),
        new ForeignKeyMetadata("status_id", "status", "status_id")
    );
    
    private SampleTableMetadata() {
    }
    
    public static List<ColumnMetadata> getColumns() {
        return COLUMNS;
    }
    
    /**
     * Columns of the composite index created on every bucket.
     */
    public static List<String> getIndexColumns() {
        return INDEX_COLUMNS;
    }
    
    public static List<ForeignKeyMetadata> getForeignKeys() {
        return FOREIGN_KEYS;
    }
    
    /**
     * Name of the composite index on a bucket table
     */
    public static String indexName(String bucketTable) {
        return bucketTable + "_channel_time_idx";
    }
    
    /**
     * Name of the bounding check constraint on a bucket table
     */
    public static String checkConstraintName(String bucketTable) {
        return bucketTable + "_smpl_time_check";
    }
}
