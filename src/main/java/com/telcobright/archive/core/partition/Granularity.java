package com.telcobright.archive.core.partition;

import com.telcobright.archive.core.exception.InvalidGranularityException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Width of a sample bucket.
 *
 * Each granularity knows how to align a timestamp to its bucket boundary
 * (the same way PostgreSQL date_trunc does), how to step to the next
 * boundary and how to render the boundary as a table name suffix.
 * Suffixes start with a distinct letter so names never collide across
 * granularities.
 */
public enum Granularity {

    /**
     * One bucket per calendar day, suffix d + year + day-of-year (d2012153).
     */
    DAY("day", new DateTimeFormatterBuilder()
            .appendLiteral('d')
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.DAY_OF_YEAR, 3)
            .toFormatter(Locale.ROOT)),

    /**
     * One bucket per ISO week starting Monday, suffix w + week-based year + w + week (w2012w22).
     */
    WEEK("week", new DateTimeFormatterBuilder()
            .appendLiteral('w')
            .appendValue(IsoFields.WEEK_BASED_YEAR, 4)
            .appendLiteral('w')
            .appendValue(IsoFields.WEEK_OF_WEEK_BASED_YEAR, 2)
            .parseDefaulting(ChronoField.DAY_OF_WEEK, DayOfWeek.MONDAY.getValue())
            .toFormatter(Locale.ROOT)),

    /**
     * One bucket per calendar month, suffix m + year + month (m201206).
     */
    MONTH("month", new DateTimeFormatterBuilder()
            .appendLiteral('m')
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
            .toFormatter(Locale.ROOT)),

    /**
     * One bucket per calendar year, suffix y + year (y2012).
     */
    YEAR("year", new DateTimeFormatterBuilder()
            .appendLiteral('y')
            .appendValue(ChronoField.YEAR, 4)
            .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
            .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
            .toFormatter(Locale.ROOT));

    private final String plan;
    private final DateTimeFormatter suffixFormat;

    Granularity(String plan, DateTimeFormatter suffixFormat) {
        this.plan = plan;
        this.suffixFormat = suffixFormat;
    }

    /**
     * The plan keyword accepted by the maintenance operation (day, week, month, year).
     */
    public String getPlan() {
        return plan;
    }

    /**
     * Resolve a plan keyword, ignoring case and surrounding whitespace.
     *
     * @throws InvalidGranularityException if the plan is not one of day, week, month, year
     */
    public static Granularity fromPlan(String plan) {
        if (plan != null) {
            String normalized = plan.trim().toLowerCase(Locale.ROOT);
            for (Granularity granularity : values()) {
                if (granularity.plan.equals(normalized)) {
                    return granularity;
                }
            }
        }
        throw new InvalidGranularityException(plan);
    }

    /**
     * Align a timestamp down to the start of the bucket containing it.
     */
    public LocalDateTime truncate(LocalDateTime timestamp) {
        LocalDate date = timestamp.toLocalDate();
        switch (this) {
            case DAY:
                return date.atStartOfDay();
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
            case MONTH:
                return date.withDayOfMonth(1).atStartOfDay();
            case YEAR:
                return date.withDayOfYear(1).atStartOfDay();
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    /**
     * Add one bucket width to a timestamp.
     */
    public LocalDateTime advance(LocalDateTime timestamp) {
        switch (this) {
            case DAY:
                return timestamp.plusDays(1);
            case WEEK:
                return timestamp.plusWeeks(1);
            case MONTH:
                return timestamp.plusMonths(1);
            case YEAR:
                return timestamp.plusYears(1);
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    String formatSuffix(LocalDateTime bucketStart) {
        return bucketStart.format(suffixFormat);
    }

    LocalDate parseSuffix(String suffix) {
        return LocalDate.parse(suffix, suffixFormat);
    }
}
