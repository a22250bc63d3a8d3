package com.telcobright.archive.core.exception;

/**
 * Thrown when the target namespace is not set up for partitioning:
 * a missing owner role, a missing parent table or a missing lookup
 * relation referenced by a bucket foreign key.
 */
public class ConfigurationException extends PartitionMaintenanceException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
