package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.partition.Bucket;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one synchronizer pass: every bucket in the run window
 * (created or already present, oldest first) and the ones created now.
 */
public class SynchronizationResult {

    private final List<Bucket> buckets;
    private final List<Bucket> createdBuckets;

    public SynchronizationResult(List<Bucket> buckets, List<Bucket> createdBuckets) {
        this.buckets = Collections.unmodifiableList(buckets);
        this.createdBuckets = Collections.unmodifiableList(createdBuckets);
    }

    public List<Bucket> getBuckets() {
        return buckets;
    }

    public List<Bucket> getCreatedBuckets() {
        return createdBuckets;
    }

    public int getCreatedCount() {
        return createdBuckets.size();
    }
}
