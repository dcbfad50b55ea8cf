package io.jobwarden.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Coercions for loosely typed record attributes and job operands.
 *
 * <p>Job definitions store ids as strings while records may hold numbers, so comparisons go
 * through {@link #asText(Object)}.
 */
public final class Values {
    private Values() {
    }

    /**
     * Canonical text form: integral numbers without fraction, everything else via toString.
     */
    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    /**
     * Operand as a list of strings. Null, blank strings and blank list items are dropped.
     */
    public static List<String> asTextList(Object value) {
        List<String> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        if (value instanceof Collection<?> c) {
            for (Object o : c) {
                String s = asText(o);
                if (s != null && !s.isBlank()) {
                    out.add(s);
                }
            }
            return out;
        }
        if (value instanceof Object[] arr) {
            return asTextList(List.of(arr));
        }
        String s = asText(value);
        if (s != null && !s.isBlank()) {
            out.add(s);
        }
        return out;
    }

    /**
     * Timestamp attribute as an {@link Instant}. Dates without time are read as UTC midnight.
     *
     * @throws IllegalArgumentException for values that do not denote a point in time
     */
    public static Instant asInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant i) {
            return i;
        }
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (value instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (value instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        String s = value.toString().trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // fall through to date-only / offset forms
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Not a timestamp: " + value);
        }
    }

    /**
     * True when both values have the same text form, or both are collections with equal text items.
     */
    public static boolean sameValue(Object current, Object target) {
        if (current instanceof Collection<?> || target instanceof Collection<?>) {
            return asTextList(current).equals(asTextList(target));
        }
        return Objects.equals(asText(current), asText(target));
    }
}
