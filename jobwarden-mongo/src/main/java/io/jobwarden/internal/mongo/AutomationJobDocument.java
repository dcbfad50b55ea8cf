package io.jobwarden.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for automation job definitions.
 *
 * <p>{@code condition} and {@code perform} are stored as lists of entries rather than maps keyed by
 * attribute path, since the paths contain dots.
 */
@Document(collection = "automation_jobs")
public class AutomationJobDocument {

    @Id
    private String id;

    private String name;
    private boolean active;
    private boolean disableNotification;

    // days / hours / minutes, each bucket key -> enabled
    private Map<String, Map<String, Object>> timeplan;

    private List<Map<String, Object>> condition;
    private List<Map<String, Object>> perform;

    @Field(write = Field.Write.ALWAYS)
    private Instant lastRunAt;

    private Instant createdAt;
    private Instant updatedAt;

    public AutomationJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isDisableNotification() {
        return disableNotification;
    }

    public void setDisableNotification(boolean disableNotification) {
        this.disableNotification = disableNotification;
    }

    public Map<String, Map<String, Object>> getTimeplan() {
        return timeplan;
    }

    public void setTimeplan(Map<String, Map<String, Object>> timeplan) {
        this.timeplan = timeplan;
    }

    public List<Map<String, Object>> getCondition() {
        return condition;
    }

    public void setCondition(List<Map<String, Object>> condition) {
        this.condition = condition;
    }

    public List<Map<String, Object>> getPerform() {
        return perform;
    }

    public void setPerform(List<Map<String, Object>> perform) {
        this.perform = perform;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
