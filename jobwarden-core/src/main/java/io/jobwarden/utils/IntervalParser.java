package io.jobwarden.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interval parsing for the pass trigger ({@code jobwarden.runner.run-every}) and the monitoring
 * {@code periode} parameter.
 * <p>
 * A run-every spec is one of:
 * <ul>
 *   <li>plain seconds: "600"</li>
 *   <li>compact: "30s", "10m", "1h", "2d", "1w"</li>
 *   <li>unit pairs: "5 minutes", "1 hour 30 minutes"</li>
 *   <li>cron, 5 or 6 fields: "*&#47;10 * * * *"; the next tick is the next cron occurrence</li>
 * </ul>
 */
public final class IntervalParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern COMPACT = Pattern.compile("(\\d+)\\s*([smhdw])");

    private static final Map<String, Duration> UNITS = Map.of(
            "second", Duration.ofSeconds(1),
            "minute", Duration.ofMinutes(1),
            "hour", Duration.ofHours(1),
            "day", Duration.ofDays(1),
            "week", Duration.ofDays(7),
            "month", Duration.ofDays(30)
    );

    private IntervalParser() {
    }

    /**
     * Next trigger instant: the later of {@code previous} and {@code finished}, advanced by the spec.
     * A pass that overran its slot therefore never causes an immediate catch-up pass.
     *
     * @param timezone zone id for cron evaluation; null or unknown falls back to the system zone
     */
    public static Instant computeNextRunAt(String spec, String timezone, Instant previous, Instant finished) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(finished, "finished must not be null");

        Instant base = previous != null && previous.isAfter(finished) ? previous : finished;
        return base.plus(parseDuration(spec, timezone, base));
    }

    /**
     * Time from {@code from} until the spec next fires.
     *
     * @throws IllegalArgumentException when the spec is neither a cron expression nor an interval
     */
    public static Duration parseDuration(String spec, String timezone, Instant from) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(from, "from must not be null");

        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        if (!DIGITS.matcher(s).matches() && looksLikeCron(s)) {
            return untilNextCron(toQuartz(s), zone(timezone), from);
        }
        return parseHumanDuration(s);
    }

    /**
     * Monitoring period: a positive integer followed by exactly one of {@code s m h d}.
     *
     * @throws IllegalArgumentException with a caller-facing reason
     */
    public static Duration parsePeriod(String periode) {
        if (periode == null || periode.isBlank()) {
            throw new IllegalArgumentException("periode is missing!");
        }
        String s = periode.trim();
        char scale = s.charAt(s.length() - 1);
        if ("smhd".indexOf(scale) < 0) {
            throw new IllegalArgumentException("periode need to have s, m, h or d as last!");
        }
        String digits = s.substring(0, s.length() - 1);
        if (!DIGITS.matcher(digits).matches() || Long.parseLong(digits) == 0) {
            throw new IllegalArgumentException("periode need to be an integer!");
        }
        return compact(Long.parseLong(digits), scale);
    }

    public static boolean looksLikeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        return CronExpression.isValidExpression(toQuartz(spec.trim()));
    }

    /**
     * Seconds, compact or unit-pair interval. Units may be plural; each unit may appear once.
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (DIGITS.matcher(s).matches()) {
            long seconds = Long.parseLong(s);
            if (seconds == 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            return compact(Long.parseLong(compact.group(1)), compact.group(2).charAt(0));
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }
        Duration total = Duration.ZERO;
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < parts.length; i += 2) {
            if (!DIGITS.matcher(parts[i]).matches()) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            String unit = parts[i + 1].endsWith("s") ? parts[i + 1].substring(0, parts[i + 1].length() - 1) : parts[i + 1];
            Duration size = UNITS.get(unit);
            if (size == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            total = total.plus(size.multipliedBy(Long.parseLong(parts[i])));
        }
        return total;
    }

    private static Duration compact(long n, char unit) {
        switch (unit) {
            case 's':
                return Duration.ofSeconds(n);
            case 'm':
                return Duration.ofMinutes(n);
            case 'h':
                return Duration.ofHours(n);
            case 'd':
                return Duration.ofDays(n);
            case 'w':
                return Duration.ofDays(7L * n);
            default:
                throw new IllegalArgumentException("Unsupported compact unit: " + unit);
        }
    }

    // Quartz wants seconds first and "?" in one of the day fields.
    private static String toQuartz(String cron) {
        String[] f = cron.split("\\s+");
        if (f.length != 5 && f.length != 6) {
            return cron;
        }
        String[] q = f.length == 5 ? new String[]{"0", f[0], f[1], f[2], f[3], f[4]} : f.clone();
        if ("*".equals(q[3]) && "*".equals(q[5])) {
            q[5] = "?";
        }
        return String.join(" ", q);
    }

    private static Duration untilNextCron(String cron, ZoneId zone, Instant from) {
        CronExpression expression;
        try {
            expression = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        expression.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = expression.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return Duration.between(from, next.toInstant());
    }

    private static ZoneId zone(String timezone) {
        if (timezone == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException ex) {
            return ZoneId.systemDefault();
        }
    }
}
