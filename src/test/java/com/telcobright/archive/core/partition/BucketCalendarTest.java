package com.telcobright.archive.core.partition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BucketCalendar Tests")
class BucketCalendarTest {

    private static Clock clockAt(LocalDateTime now) {
        return Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Weekly window from 2012-06-01 should hold the current and the next week")
    void testWeeklyWindow() {
        BucketCalendar calendar = new BucketCalendar(Granularity.WEEK, clockAt(LocalDateTime.of(2012, 6, 1, 10, 0)));

        List<Bucket> window = calendar.window(LocalDateTime.of(2012, 6, 1, 0, 0));

        assertThat(window).extracting(Bucket::getName).containsExactly("sample_w2012w22", "sample_w2012w23");
        assertThat(calendar.horizon()).isEqualTo(LocalDateTime.of(2012, 6, 4, 0, 0));
    }

    @Test
    @DisplayName("Window should grow by one bucket a week later")
    void testWeeklyWindowOneWeekLater() {
        BucketCalendar calendar = new BucketCalendar(Granularity.WEEK, clockAt(LocalDateTime.of(2012, 6, 8, 10, 0)));

        assertThat(calendar.window(LocalDateTime.of(2012, 6, 1, 0, 0)))
            .extracting(Bucket::getName)
            .containsExactly("sample_w2012w22", "sample_w2012w23", "sample_w2012w24");
    }

    @Test
    @DisplayName("Window should be empty when begin time lies beyond the horizon")
    void testBeginAfterHorizon() {
        BucketCalendar calendar = new BucketCalendar(Granularity.MONTH, clockAt(LocalDateTime.of(2012, 6, 15, 0, 0)));

        assertThat(calendar.window(LocalDateTime.of(2013, 1, 1, 0, 0))).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(Granularity.class)
    @DisplayName("Window should cover every instant from begin time to one bucket ahead, without overlap")
    void testCoverageAndForwardSafety(Granularity granularity) {
        LocalDateTime now = LocalDateTime.of(2012, 6, 30, 23, 59, 59);
        LocalDateTime begin = LocalDateTime.of(2011, 11, 17, 6, 30);
        BucketCalendar calendar = new BucketCalendar(granularity, clockAt(now));

        List<Bucket> window = calendar.window(begin);

        assertThat(window).isNotEmpty();
        assertThat(window.get(0).contains(begin)).isTrue();
        for (int i = 1; i < window.size(); i++) {
            assertThat(window.get(i).getStart()).isEqualTo(window.get(i - 1).getEnd());
            assertThat(window.get(i).overlaps(window.get(i - 1))).isFalse();
        }
        LocalDateTime oneAhead = granularity.advance(now);
        assertThat(window).filteredOn(b -> b.contains(oneAhead)).hasSize(1);
        assertThat(window).filteredOn(b -> b.contains(now)).hasSize(1);
    }

    @Test
    @DisplayName("Between should include the bucket starting exactly at the upper bound")
    void testBetweenInclusive() {
        BucketCalendar calendar = new BucketCalendar(Granularity.DAY, clockAt(LocalDateTime.of(2012, 6, 1, 0, 0)));

        List<Bucket> days = calendar.between(LocalDateTime.of(2012, 6, 1, 13, 0), LocalDateTime.of(2012, 6, 3, 0, 0));

        assertThat(days).extracting(Bucket::getName)
            .containsExactly("sample_d2012153", "sample_d2012154", "sample_d2012155");
    }
}
