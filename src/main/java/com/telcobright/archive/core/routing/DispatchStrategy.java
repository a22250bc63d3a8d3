package com.telcobright.archive.core.routing;

/**
 * Shape of the generated dispatch routine.
 */
public enum DispatchStrategy {

    /**
     * IF / ELSIF chain with the newest bucket tested first. Cheap for inserts
     * of recent samples, linear in the number of buckets otherwise.
     */
    LINEAR_NEWEST_FIRST,

    /**
     * Nested comparisons against the sorted bucket boundaries, logarithmic in
     * the number of buckets.
     */
    BINARY_SEARCH
}
