package com.telcobright.archive.core.exception;

/**
 * Base class for failures raised by partition maintenance and routing.
 */
public class PartitionMaintenanceException extends RuntimeException {

    public PartitionMaintenanceException(String message) {
        super(message);
    }

    public PartitionMaintenanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
