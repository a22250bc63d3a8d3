package com.telcobright.archive.core.partition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Bucket Tests")
class BucketTest {

    private static final LocalDateTime JUNE_FIRST = LocalDateTime.of(2012, 6, 1, 12, 0);

    @Test
    @DisplayName("Should derive canonical names per granularity")
    void testNames() {
        assertThat(Bucket.containing(JUNE_FIRST, Granularity.DAY).getName()).isEqualTo("sample_d2012153");
        assertThat(Bucket.containing(JUNE_FIRST, Granularity.WEEK).getName()).isEqualTo("sample_w2012w22");
        assertThat(Bucket.containing(JUNE_FIRST, Granularity.MONTH).getName()).isEqualTo("sample_m201206");
        assertThat(Bucket.containing(JUNE_FIRST, Granularity.YEAR).getName()).isEqualTo("sample_y2012");
    }

    @Test
    @DisplayName("Should name weeks by ISO week-based year")
    void testWeekNamesAroundNewYear() {
        Bucket lateDecember = Bucket.containing(LocalDateTime.of(2012, 12, 31, 8, 0), Granularity.WEEK);
        assertThat(lateDecember.getName()).isEqualTo("sample_w2013w01");
        assertThat(lateDecember.getStart()).isEqualTo(LocalDateTime.of(2012, 12, 31, 0, 0));

        Bucket earlyJanuary = Bucket.containing(LocalDateTime.of(2010, 1, 3, 8, 0), Granularity.WEEK);
        assertThat(earlyJanuary.getName()).isEqualTo("sample_w2009w53");
        assertThat(earlyJanuary.getStart()).isEqualTo(LocalDateTime.of(2009, 12, 28, 0, 0));
    }

    @Test
    @DisplayName("Should cover a half-open interval")
    void testContains() {
        Bucket week = Bucket.containing(JUNE_FIRST, Granularity.WEEK);

        assertThat(week.getStart()).isEqualTo(LocalDateTime.of(2012, 5, 28, 0, 0));
        assertThat(week.getEnd()).isEqualTo(LocalDateTime.of(2012, 6, 4, 0, 0));
        assertThat(week.contains(week.getStart())).isTrue();
        assertThat(week.contains(week.getEnd().minusNanos(1))).isTrue();
        assertThat(week.contains(week.getEnd())).isFalse();
        assertThat(week.contains(week.getStart().minusNanos(1))).isFalse();
    }

    @Test
    @DisplayName("Consecutive buckets should be contiguous and not overlap")
    void testNextIsContiguous() {
        Bucket month = Bucket.containing(JUNE_FIRST, Granularity.MONTH);
        Bucket next = month.next();

        assertThat(next.getStart()).isEqualTo(month.getEnd());
        assertThat(month.overlaps(next)).isFalse();
        assertThat(month.overlaps(month)).isTrue();
        assertThat(next).isGreaterThan(month);
    }

    @ParameterizedTest
    @EnumSource(Granularity.class)
    @DisplayName("Should recover a bucket from its table name")
    void testFromTableName(Granularity granularity) {
        Bucket bucket = Bucket.containing(JUNE_FIRST, granularity);

        assertThat(Bucket.fromTableName(bucket.getName(), granularity)).contains(bucket);
    }

    @Test
    @DisplayName("Should ignore names of other granularities and foreign tables")
    void testFromTableNameRejectsForeignNames() {
        assertThat(Bucket.fromTableName("sample_m201206", Granularity.WEEK)).isEmpty();
        assertThat(Bucket.fromTableName("sample_w2012w22", Granularity.MONTH)).isEmpty();
        assertThat(Bucket.fromTableName("sample_201206", Granularity.MONTH)).isEmpty();
        assertThat(Bucket.fromTableName("sample_m201213", Granularity.MONTH)).isEmpty();
        assertThat(Bucket.fromTableName("sample_w2012w53", Granularity.WEEK)).isEmpty();
        assertThat(Bucket.fromTableName("sample_d2011366", Granularity.DAY)).isEmpty();
        assertThat(Bucket.fromTableName("channel", Granularity.DAY)).isEmpty();
        assertThat(Bucket.fromTableName(null, Granularity.DAY)).isEmpty();
    }

    @Test
    @DisplayName("Names should never collide across granularities")
    void testNoCrossGranularityCollisions() {
        Set<String> names = new HashSet<>();
        LocalDateTime cursor = LocalDateTime.of(2011, 1, 1, 0, 0);
        int generated = 0;
        while (cursor.getYear() < 2013) {
            for (Granularity granularity : Granularity.values()) {
                Bucket bucket = Bucket.containing(cursor, granularity);
                if (names.add(bucket.getName())) {
                    generated++;
                    for (Granularity other : Granularity.values()) {
                        if (other != granularity) {
                            assertThat(Bucket.fromTableName(bucket.getName(), other)).isEmpty();
                        }
                    }
                }
            }
            cursor = cursor.plusDays(1);
        }
        assertThat(generated).isEqualTo(names.size());
    }
}
