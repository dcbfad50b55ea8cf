package io.jobwarden.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobwarden.AutomationJobStore;
import io.jobwarden.core.AutomationJob;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.JobConfigurationException;
import io.jobwarden.core.PerformAction;
import io.jobwarden.core.Timeplan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence for automation job definitions.
 *
 * <p>{@link #markRun(String, Instant)} touches {@code lastRunAt} only; {@code updatedAt} belongs to
 * whoever edits the definition.
 */
public class MongoAutomationJobStore implements AutomationJobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoAutomationJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoAutomationJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Active jobs by name. A definition that cannot be decoded is logged and left out.
     */
    @Override
    public List<AutomationJob> findActive() {
        Query q = new Query(Criteria.where("active").is(true));
        q.with(Sort.by(Sort.Order.asc("name")));

        List<AutomationJob> jobs = new ArrayList<>();
        for (AutomationJobDocument doc : mongoTemplate.find(q, AutomationJobDocument.class)) {
            try {
                jobs.add(toJob(doc));
            } catch (JobConfigurationException e) {
                log.error("jobwarden job definition invalid name={} id={} msg={}", doc.getName(), doc.getId(), e.getMessage());
            }
        }
        return jobs;
    }

    @Override
    public void markRun(String jobId, Instant lastRunAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(lastRunAt, "lastRunAt must not be null");

        Query q = new Query(Criteria.where("_id").is(jobId));
        mongoTemplate.updateFirst(q, new Update().set("lastRunAt", lastRunAt), AutomationJobDocument.class);
    }

    /**
     * Insert or replace a definition. Stamps {@code updatedAt} with {@code editedAt}, which restarts
     * the job's cooldown.
     *
     * @return the document id
     */
    public String save(AutomationJob job, Instant editedAt) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(editedAt, "editedAt must not be null");

        AutomationJobDocument doc = toDocument(job);
        doc.setUpdatedAt(editedAt);
        if (doc.getId() == null) {
            doc.setCreatedAt(editedAt);
            return mongoTemplate.insert(doc).getId();
        }
        AutomationJobDocument existing = mongoTemplate.findById(doc.getId(), AutomationJobDocument.class);
        doc.setCreatedAt(existing == null ? editedAt : existing.getCreatedAt());
        return mongoTemplate.save(doc).getId();
    }

    public AutomationJob findById(String id) {
        AutomationJobDocument doc = mongoTemplate.findById(id, AutomationJobDocument.class);
        return doc == null ? null : toJob(doc);
    }

    AutomationJob toJob(AutomationJobDocument doc) {
        Map<String, Map<String, Object>> plan = doc.getTimeplan() == null ? Map.of() : doc.getTimeplan();
        Timeplan timeplan = Timeplan.fromMaps(plan.get("days"), plan.get("hours"), plan.get("minutes"));

        List<ConditionPredicate> condition = convertEntries(doc.getCondition(), new TypeReference<List<ConditionPredicate>>() {
        });
        List<PerformAction> perform = convertEntries(doc.getPerform(), new TypeReference<List<PerformAction>>() {
        });

        Instant updatedAt = doc.getUpdatedAt() != null ? doc.getUpdatedAt() : doc.getCreatedAt();
        if (updatedAt == null) {
            throw new JobConfigurationException("job '" + doc.getName() + "' has no updatedAt");
        }

        return new AutomationJob(
                doc.getId(),
                doc.getName(),
                timeplan,
                condition,
                perform,
                doc.isActive(),
                doc.isDisableNotification(),
                doc.getLastRunAt(),
                updatedAt
        );
    }

    private AutomationJobDocument toDocument(AutomationJob job) {
        AutomationJobDocument doc = new AutomationJobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setActive(job.active());
        doc.setDisableNotification(job.disableNotification());
        doc.setTimeplan(objectMapper.convertValue(job.timeplan().toMaps(), new TypeReference<Map<String, Map<String, Object>>>() {
        }));
        doc.setCondition(objectMapper.convertValue(job.condition(), new TypeReference<List<Map<String, Object>>>() {
        }));
        doc.setPerform(objectMapper.convertValue(job.perform(), new TypeReference<List<Map<String, Object>>>() {
        }));
        doc.setLastRunAt(job.lastRunAt());
        return doc;
    }

    private <T> List<T> convertEntries(List<Map<String, Object>> raw, TypeReference<List<T>> type) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException("cannot decode job entries: " + e.getMessage(), e);
        }
    }
}
