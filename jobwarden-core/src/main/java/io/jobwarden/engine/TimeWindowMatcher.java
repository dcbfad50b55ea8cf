package io.jobwarden.engine;

import io.jobwarden.core.Timeplan;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Decides whether an instant falls into a {@link Timeplan}, read in a fixed zone.
 */
public class TimeWindowMatcher {

    private final ZoneId zone;

    public TimeWindowMatcher(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * True iff weekday, hour and 10-minute bucket of {@code now} are all enabled.
     */
    public boolean inWindow(Timeplan timeplan, Instant now) {
        Objects.requireNonNull(timeplan, "timeplan must not be null");
        Objects.requireNonNull(now, "now must not be null");

        ZonedDateTime t = now.atZone(zone);
        return timeplan.isDayEnabled(t.getDayOfWeek())
                && timeplan.isHourEnabled(t.getHour())
                && timeplan.isMinuteEnabled(t.getMinute());
    }

    public ZoneId zone() {
        return zone;
    }
}
