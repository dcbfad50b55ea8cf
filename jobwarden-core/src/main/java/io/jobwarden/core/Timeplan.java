package io.jobwarden.core;

import java.time.DayOfWeek;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recurring weekly schedule with 10-minute granularity.
 *
 * <p>Backed by three fixed-size bitsets: weekday (0 = Monday .. 6 = Sunday), hour (0..23) and
 * minute bucket (0..5, i.e. minutes 0, 10, .. 50). A bucket that was never enabled is off.
 *
 * <p>The persisted form is the map layout used by job definitions:
 * <pre>
 *   days:    { Mon: true, Tue: false, ... Sun: true }
 *   hours:   { "0": false, ... "23": true }
 *   minutes: { "0": true, "10": false, ... "50": false }
 * </pre>
 */
public final class Timeplan {

    public static final int DAYS = 7;
    public static final int HOURS = 24;
    public static final int MINUTE_BUCKETS = 6;

    private static final List<String> DAY_KEYS = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");

    private final BitSet days;
    private final BitSet hours;
    private final BitSet minutes;

    private Timeplan(BitSet days, BitSet hours, BitSet minutes) {
        this.days = (BitSet) days.clone();
        this.hours = (BitSet) hours.clone();
        this.minutes = (BitSet) minutes.clone();
    }

    public static Timeplan always() {
        Builder b = builder();
        b.days.set(0, DAYS);
        b.hours.set(0, HOURS);
        b.minutes.set(0, MINUTE_BUCKETS);
        return b.build();
    }

    public static Timeplan never() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decode the persisted map layout. Missing maps or keys mean "off"; values may be
     * booleans or boolean strings.
     *
     * @throws JobConfigurationException for a key outside the known buckets
     */
    public static Timeplan fromMaps(Map<String, ?> days, Map<String, ?> hours, Map<String, ?> minutes) {
        Builder b = builder();
        if (days != null) {
            for (var e : days.entrySet()) {
                int idx = DAY_KEYS.indexOf(e.getKey());
                if (idx < 0) {
                    throw new JobConfigurationException("Malformed timeplan day bucket: " + e.getKey());
                }
                b.days.set(idx, isOn(e.getValue()));
            }
        }
        if (hours != null) {
            for (var e : hours.entrySet()) {
                int hour = parseBucket(e.getKey(), "hour");
                if (hour < 0 || hour >= HOURS) {
                    throw new JobConfigurationException("Malformed timeplan hour bucket: " + e.getKey());
                }
                b.hours.set(hour, isOn(e.getValue()));
            }
        }
        if (minutes != null) {
            for (var e : minutes.entrySet()) {
                int minute = parseBucket(e.getKey(), "minute");
                if (minute < 0 || minute > 50 || minute % 10 != 0) {
                    throw new JobConfigurationException("Malformed timeplan minute bucket: " + e.getKey());
                }
                b.minutes.set(minute / 10, isOn(e.getValue()));
            }
        }
        return b.build();
    }

    /**
     * Inverse of {@link #fromMaps(Map, Map, Map)}; every bucket is present.
     */
    public Map<String, Map<String, Boolean>> toMaps() {
        Map<String, Boolean> d = new LinkedHashMap<>();
        for (int i = 0; i < DAYS; i++) {
            d.put(DAY_KEYS.get(i), days.get(i));
        }
        Map<String, Boolean> h = new LinkedHashMap<>();
        for (int i = 0; i < HOURS; i++) {
            h.put(Integer.toString(i), hours.get(i));
        }
        Map<String, Boolean> m = new LinkedHashMap<>();
        for (int i = 0; i < MINUTE_BUCKETS; i++) {
            m.put(Integer.toString(i * 10), minutes.get(i));
        }
        Map<String, Map<String, Boolean>> out = new LinkedHashMap<>();
        out.put("days", d);
        out.put("hours", h);
        out.put("minutes", m);
        return out;
    }

    public boolean isDayEnabled(DayOfWeek day) {
        return days.get(day.getValue() - 1);
    }

    public boolean isHourEnabled(int hour) {
        return hour >= 0 && hour < HOURS && hours.get(hour);
    }

    /**
     * @param minute minute of hour (0..59); mapped to its 10-minute bucket
     */
    public boolean isMinuteEnabled(int minute) {
        return minute >= 0 && minute < 60 && minutes.get(minute / 10);
    }

    private static int parseBucket(Object key, String kind) {
        try {
            return Integer.parseInt(String.valueOf(key).trim());
        } catch (NumberFormatException ex) {
            throw new JobConfigurationException("Malformed timeplan " + kind + " bucket: " + key);
        }
    }

    private static boolean isOn(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Timeplan other)) return false;
        return days.equals(other.days) && hours.equals(other.hours) && minutes.equals(other.minutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(days, hours, minutes);
    }

    @Override
    public String toString() {
        return "Timeplan{days=" + days + ", hours=" + hours + ", minutes=" + minutes + "}";
    }

    public static final class Builder {
        private final BitSet days = new BitSet(DAYS);
        private final BitSet hours = new BitSet(HOURS);
        private final BitSet minutes = new BitSet(MINUTE_BUCKETS);

        public Builder day(DayOfWeek day) {
            Objects.requireNonNull(day, "day must not be null");
            days.set(day.getValue() - 1);
            return this;
        }

        public Builder hour(int hour) {
            if (hour < 0 || hour >= HOURS) {
                throw new IllegalArgumentException("hour must be within 0..23: " + hour);
            }
            hours.set(hour);
            return this;
        }

        /**
         * Enable the 10-minute bucket containing {@code minute}.
         */
        public Builder minute(int minute) {
            if (minute < 0 || minute >= 60) {
                throw new IllegalArgumentException("minute must be within 0..59: " + minute);
            }
            minutes.set(minute / 10);
            return this;
        }

        public Builder allDays() {
            days.set(0, DAYS);
            return this;
        }

        public Builder allHours() {
            hours.set(0, HOURS);
            return this;
        }

        public Builder allMinutes() {
            minutes.set(0, MINUTE_BUCKETS);
            return this;
        }

        public Timeplan build() {
            return new Timeplan(days, hours, minutes);
        }
    }
}
