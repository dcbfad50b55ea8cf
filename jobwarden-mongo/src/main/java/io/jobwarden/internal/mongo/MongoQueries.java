package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.TransientCollaboratorException;
import org.bson.Document;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.Date;
import java.util.function.Supplier;

final class MongoQueries {
    private MongoQueries() {
    }

    /**
     * Run a read against a monitored collection; driver and mapping failures become
     * {@link TransientCollaboratorException}.
     */
    static <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new TransientCollaboratorException("cannot read " + what + ": " + e.getMessage(), e);
        }
    }

    static Instant instant(Document doc, String field) {
        Object v = doc.get(field);
        if (v instanceof Date d) {
            return d.toInstant();
        }
        if (v instanceof Instant i) {
            return i;
        }
        return null;
    }

    static String string(Document doc, String field) {
        Object v = doc.get(field);
        return v == null ? null : v.toString();
    }

    static boolean flag(Document doc, String field) {
        Object v = doc.get(field);
        return v instanceof Boolean b ? b : v != null && Boolean.parseBoolean(v.toString());
    }

    static long number(Document doc, String field) {
        Object v = doc.get(field);
        return v instanceof Number n ? n.longValue() : 0L;
    }
}
