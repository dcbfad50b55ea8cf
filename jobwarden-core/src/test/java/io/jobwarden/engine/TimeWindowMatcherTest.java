package io.jobwarden.engine;

import io.jobwarden.core.Timeplan;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeWindowMatcherTest {

    // Friday 09:05 UTC
    private static final Instant FRIDAY = Instant.parse("2026-01-09T09:05:00Z");

    private final TimeWindowMatcher utc = new TimeWindowMatcher(ZoneOffset.UTC);

    @Test
    void alwaysAndNever() {
        assertTrue(utc.inWindow(Timeplan.always(), FRIDAY));
        assertFalse(utc.inWindow(Timeplan.never(), FRIDAY));
    }

    @Test
    void exactBucketMatches() {
        Timeplan plan = Timeplan.builder().day(DayOfWeek.FRIDAY).hour(9).minute(0).build();

        assertTrue(utc.inWindow(plan, FRIDAY));
        assertTrue(utc.inWindow(plan, Instant.parse("2026-01-09T09:09:59Z")));
        assertFalse(utc.inWindow(plan, Instant.parse("2026-01-09T09:10:00Z")));
        assertFalse(utc.inWindow(plan, Instant.parse("2026-01-09T10:05:00Z")));
        assertFalse(utc.inWindow(plan, Instant.parse("2026-01-10T09:05:00Z")));
    }

    @Test
    void everyDimensionMustBeEnabled() {
        assertFalse(utc.inWindow(Timeplan.builder().allDays().allHours().build(), FRIDAY));
        assertFalse(utc.inWindow(Timeplan.builder().allDays().allMinutes().build(), FRIDAY));
        assertFalse(utc.inWindow(Timeplan.builder().allHours().allMinutes().build(), FRIDAY));
    }

    @Test
    void instantIsReadInConfiguredZone() {
        Timeplan plan = Timeplan.builder().day(DayOfWeek.FRIDAY).hour(10).minute(0).build();
        TimeWindowMatcher berlin = new TimeWindowMatcher(ZoneId.of("Europe/Berlin"));

        assertTrue(berlin.inWindow(plan, FRIDAY));
        assertFalse(utc.inWindow(plan, FRIDAY));
    }
}
