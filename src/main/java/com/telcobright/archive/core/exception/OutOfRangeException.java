package com.telcobright.archive.core.exception;

import java.time.LocalDateTime;

/**
 * Thrown when a sample timestamp falls outside every known bucket.
 * Usually means maintenance has not kept pace with real time, or the row
 * carries a bad timestamp.
 */
public class OutOfRangeException extends PartitionMaintenanceException {

    private final String schema;
    private final LocalDateTime timestamp;

    public OutOfRangeException(String schema, LocalDateTime timestamp) {
        super(String.format("Error in %s.sample_insert_trigger_function(): smpl_time %s out of range",
            schema, timestamp));
        this.schema = schema;
        this.timestamp = timestamp;
    }

    public String getSchema() {
        return schema;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }
}
