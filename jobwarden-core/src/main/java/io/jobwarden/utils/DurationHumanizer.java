package io.jobwarden.utils;

import java.time.Duration;

/**
 * Renders a duration as approximate words ("10 minutes", "about 24 hours", "3 days").
 *
 * <p>Buckets (in rounded minutes):
 * <pre>
 *   0                 less than a minute
 *   1                 1 minute
 *   2 .. 44           N minutes
 *   45 .. 89          about 1 hour
 *   90 .. 1439        about N hours
 *   1440 .. 2519      1 day
 *   2520 .. 43199     N days
 *   43200 .. 86399    about 1 month
 *   86400 .. 525599   N months
 *   beyond            about / over / almost N years
 * </pre>
 */
public final class DurationHumanizer {
    private static final long MINUTES_IN_YEAR = 525_600L;
    private static final long MINUTES_IN_QUARTER_YEAR = 131_400L;
    private static final long MINUTES_IN_THREE_QUARTERS_YEAR = 394_200L;

    private DurationHumanizer() {
    }

    public static String inWords(Duration duration) {
        long seconds = Math.abs(duration.getSeconds());
        long minutes = Math.round(seconds / 60.0);

        if (minutes <= 1) {
            return minutes == 0 ? "less than a minute" : "1 minute";
        }
        if (minutes < 45) {
            return minutes + " minutes";
        }
        if (minutes < 90) {
            return "about 1 hour";
        }
        if (minutes < 1440) {
            return "about " + Math.round(minutes / 60.0) + " hours";
        }
        if (minutes < 2520) {
            return "1 day";
        }
        if (minutes < 43_200) {
            return Math.round(minutes / 1440.0) + " days";
        }
        if (minutes < 86_400) {
            return "about 1 month";
        }
        if (minutes < MINUTES_IN_YEAR) {
            return Math.round(minutes / 43_200.0) + " months";
        }

        long years = minutes / MINUTES_IN_YEAR;
        long remainder = minutes % MINUTES_IN_YEAR;
        if (remainder < MINUTES_IN_QUARTER_YEAR) {
            return "about " + plural(years, "year");
        }
        if (remainder < MINUTES_IN_THREE_QUARTERS_YEAR) {
            return "over " + plural(years, "year");
        }
        return "almost " + plural(years + 1, "year");
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }
}
