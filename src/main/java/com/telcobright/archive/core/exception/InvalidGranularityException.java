package com.telcobright.archive.core.exception;

/**
 * Thrown when the maintenance plan is not one of day, week, month or year.
 * Raised before any DDL is attempted.
 */
public class InvalidGranularityException extends PartitionMaintenanceException {

    private final String plan;

    public InvalidGranularityException(String plan) {
        super("Invalid plan --> " + plan + " (expected one of day, week, month, year)");
        this.plan = plan;
    }

    public String getPlan() {
        return plan;
    }
}
