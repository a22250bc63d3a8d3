package com.telcobright.archive.core.partition;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Date arithmetic for a single granularity.
 *
 * The maintenance window always runs one bucket past the current time so
 * that a job scheduled at least once per bucket period has created the
 * upcoming bucket before the first row for it arrives.
 */
public class BucketCalendar {

    private final Granularity granularity;
    private final Clock clock;

    public BucketCalendar(Granularity granularity, Clock clock) {
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Granularity getGranularity() {
        return granularity;
    }

    /**
     * Current wall-clock time in the calendar's zone.
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Start of the last bucket the window must reach: truncate(now + 1 granularity).
     */
    public LocalDateTime horizon() {
        return granularity.truncate(granularity.advance(now()));
    }

    /**
     * Buckets from the one containing beginTime up to and including the horizon bucket,
     * oldest first. Empty when beginTime lies beyond the horizon.
     */
    public List<Bucket> window(LocalDateTime beginTime) {
        return between(beginTime, horizon());
    }

    /**
     * Buckets from the one containing from up to the one starting at or before to, oldest first.
     */
    public List<Bucket> between(LocalDateTime from, LocalDateTime to) {
        List<Bucket> buckets = new ArrayList<>();
        Bucket current = Bucket.containing(from, granularity);
        while (!current.getStart().isAfter(to)) {
            buckets.add(current);
            current = current.next();
        }
        return buckets;
    }
}
