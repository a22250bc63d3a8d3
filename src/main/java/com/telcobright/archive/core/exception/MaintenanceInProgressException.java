package com.telcobright.archive.core.exception;

/**
 * Thrown when a maintenance run is attempted while another one holds the maintenance lock.
 */
public class MaintenanceInProgressException extends PartitionMaintenanceException {

    public MaintenanceInProgressException(String message) {
        super(message);
    }
}
