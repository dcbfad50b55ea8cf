package io.jobwarden.internal.mongo;

import io.jobwarden.TargetRecord;
import io.jobwarden.core.AttributePath;
import io.jobwarden.core.JobConfigurationException;
import org.bson.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A raw collection document viewed as an automation target. Writes are tracked so that only the
 * changed fields are sent back.
 */
public class DocumentTargetRecord implements TargetRecord {

    private final String entity;
    private final Document document;
    private final Map<String, Object> changes = new LinkedHashMap<>();

    public DocumentTargetRecord(String entity, Document document) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.document = Objects.requireNonNull(document, "document must not be null");
    }

    @Override
    public String id() {
        Object id = document.get("_id");
        return id == null ? null : id.toString();
    }

    Object rawId() {
        return document.get("_id");
    }

    @Override
    public String entity() {
        return entity;
    }

    @Override
    public Object get(String path) {
        String field = fieldOf(path);
        if (field.indexOf('.') < 0) {
            return document.get(field);
        }
        return document.getEmbedded(List.of(field.split("\\.")), Object.class);
    }

    @Override
    public void set(String path, Object value) {
        String field = fieldOf(path);
        changes.put(field, value);
        if (field.indexOf('.') < 0) {
            document.put(field, value);
        }
    }

    /**
     * Fields written since load, in write order.
     */
    Map<String, Object> changes() {
        return Collections.unmodifiableMap(changes);
    }

    void clearChanges() {
        changes.clear();
    }

    private String fieldOf(String path) {
        AttributePath p = AttributePath.parse(path);
        if (!p.entity().equals(entity)) {
            throw new JobConfigurationException("path " + path + " does not address entity " + entity);
        }
        return p.field();
    }
}
