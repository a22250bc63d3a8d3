package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary of one maintenance run, for logging and monitoring.
 */
public class MaintenanceResult {

    private final String schema;
    private final Granularity granularity;
    private final SynchronizationResult synchronization;
    private final RoutineInstallResult routine;
    private final long durationMs;

    public MaintenanceResult(String schema, Granularity granularity, SynchronizationResult synchronization,
                             RoutineInstallResult routine, long durationMs) {
        this.schema = schema;
        this.granularity = granularity;
        this.synchronization = synchronization;
        this.routine = routine;
        this.durationMs = durationMs;
    }

    public int getCreatedCount() {
        return synchronization.getCreatedCount();
    }

    /**
     * Names of every bucket the installed routine routes to, oldest first.
     */
    public List<String> getRoutedBucketNames() {
        return routine.getRoutine().getTable().getBuckets().stream()
            .map(Bucket::getName)
            .collect(Collectors.toList());
    }

    public String getSchema() { return schema; }
    public Granularity getGranularity() { return granularity; }
    public SynchronizationResult getSynchronization() { return synchronization; }
    public RoutineInstallResult getRoutine() { return routine; }
    public boolean isRoutineReplaced() { return routine.isReplaced(); }
    public long getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return String.format("Maintenance[%s, %s: created=%d, routed=%d, routineReplaced=%s, %dms]",
            schema, granularity.getPlan(), getCreatedCount(), getRoutedBucketNames().size(),
            isRoutineReplaced(), durationMs);
    }
}
