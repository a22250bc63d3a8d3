package com.telcobright.archive.core.routing;

import com.telcobright.archive.core.exception.OutOfRangeException;
import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Immutable routing table from sample timestamps to buckets.
 *
 * Buckets are kept sorted by start; lookups binary search the start
 * boundaries. Gaps between buckets are allowed (an older bucket may have
 * been removed by retention), overlaps and mixed granularities are not.
 */
public final class DispatchTable {

    private final String schema;
    private final List<Bucket> buckets;
    private final List<LocalDateTime> starts;

    private DispatchTable(String schema, List<Bucket> buckets) {
        this.schema = schema;
        this.buckets = Collections.unmodifiableList(buckets);
        List<LocalDateTime> boundaryList = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets) {
            boundaryList.add(bucket.getStart());
        }
        this.starts = Collections.unmodifiableList(boundaryList);
    }

    /**
     * Build a table from buckets in any order; duplicates are collapsed.
     *
     * @throws IllegalArgumentException if buckets overlap or mix granularities
     */
    public static DispatchTable of(String schema, Collection<Bucket> buckets) {
        List<Bucket> sorted = new ArrayList<>(new TreeSet<>(buckets));
        Granularity granularity = null;
        for (int i = 0; i < sorted.size(); i++) {
            Bucket bucket = sorted.get(i);
            if (granularity == null) {
                granularity = bucket.getGranularity();
            } else if (granularity != bucket.getGranularity()) {
                throw new IllegalArgumentException(String.format(
                    "Buckets of %s and %s granularity cannot share a dispatch table",
                    granularity, bucket.getGranularity()));
            }
            if (i > 0 && sorted.get(i - 1).overlaps(bucket)) {
                throw new IllegalArgumentException(String.format(
                    "Buckets %s and %s overlap", sorted.get(i - 1), bucket));
            }
        }
        return new DispatchTable(schema, sorted);
    }

    /**
     * Find the bucket whose interval contains the timestamp.
     *
     * @throws OutOfRangeException if no bucket contains it
     */
    public Bucket route(LocalDateTime timestamp) {
        int index = Collections.binarySearch(starts, timestamp);
        if (index < 0) {
            // Last bucket starting before the timestamp
            index = -index - 2;
        }
        if (index >= 0 && buckets.get(index).contains(timestamp)) {
            return buckets.get(index);
        }
        throw new OutOfRangeException(schema, timestamp);
    }

    public boolean covers(LocalDateTime timestamp) {
        try {
            route(timestamp);
            return true;
        } catch (OutOfRangeException e) {
            return false;
        }
    }

    public String getSchema() {
        return schema;
    }

    /**
     * Buckets sorted oldest first.
     */
    public List<Bucket> getBuckets() {
        return buckets;
    }

    public List<Bucket> newestFirst() {
        List<Bucket> reversed = new ArrayList<>(buckets);
        Collections.reverse(reversed);
        return reversed;
    }

    public int size() {
        return buckets.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    @Override
    public String toString() {
        return "DispatchTable[" + schema + ", " + buckets.size() + " buckets]";
    }
}
