package com.telcobright.archive.core.partition;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * One physical sub-table of the sample table, covering the half-open
 * interval [start, end).
 */
public final class Bucket implements Comparable<Bucket> {

    /**
     * Every bucket table name starts with this prefix followed by the granularity suffix.
     */
    public static final String TABLE_PREFIX = "sample_";

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Granularity granularity;
    private final String name;

    private Bucket(LocalDateTime start, Granularity granularity) {
        this.start = start;
        this.end = granularity.advance(start);
        this.granularity = granularity;
        this.name = TABLE_PREFIX + granularity.formatSuffix(start);
    }

    /**
     * The bucket of the given granularity that contains a timestamp.
     */
    public static Bucket containing(LocalDateTime timestamp, Granularity granularity) {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(granularity, "granularity");
        return new Bucket(granularity.truncate(timestamp), granularity);
    }

    /**
     * Recover a bucket from its table name.
     *
     * @return empty if the name was not produced by this granularity
     */
    public static Optional<Bucket> fromTableName(String tableName, Granularity granularity) {
        if (tableName == null || !tableName.startsWith(TABLE_PREFIX)) {
            return Optional.empty();
        }
        String suffix = tableName.substring(TABLE_PREFIX.length());
        LocalDate start;
        try {
            start = granularity.parseSuffix(suffix);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        Bucket bucket = containing(start.atStartOfDay(), granularity);
        // Lenient resolution can roll an out-of-range field into a neighbour
        return bucket.getName().equals(tableName) ? Optional.of(bucket) : Optional.empty();
    }

    /**
     * The bucket immediately after this one.
     */
    public Bucket next() {
        return new Bucket(end, granularity);
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    public boolean overlaps(Bucket other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Bucket other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bucket)) return false;
        Bucket bucket = (Bucket) o;
        return start.equals(bucket.start) && granularity == bucket.granularity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, granularity);
    }

    @Override
    public String toString() {
        return String.format("%s[%s, %s)", name, start, end);
    }
}
