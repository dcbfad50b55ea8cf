package io.jobwarden.engine;

import io.jobwarden.AutomationJobStore;
import io.jobwarden.RecordStore;
import io.jobwarden.TargetRecord;
import io.jobwarden.core.AttributePath;
import io.jobwarden.core.AutomationJob;
import io.jobwarden.core.ChangeContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory record and job stores for engine tests.
 */
final class InMemoryRecords {
    private InMemoryRecords() {
    }

    static final class MapRecord implements TargetRecord {
        private final String id;
        private final String entity;
        private final Map<String, Object> fields = new HashMap<>();

        MapRecord(String id, String entity) {
            this.id = id;
            this.entity = entity;
        }

        MapRecord with(String field, Object value) {
            fields.put(field, value);
            return this;
        }

        Object field(String field) {
            return fields.get(field);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String entity() {
            return entity;
        }

        @Override
        public Object get(String path) {
            return fields.get(fieldOf(path));
        }

        @Override
        public void set(String path, Object value) {
            fields.put(fieldOf(path), value);
        }

        private String fieldOf(String path) {
            AttributePath p = AttributePath.parse(path);
            if (!p.entity().equals(entity)) {
                throw new IllegalArgumentException("path " + path + " does not belong to " + entity);
            }
            return p.field();
        }
    }

    static final class RecordStoreStub implements RecordStore {
        private final Map<String, List<TargetRecord>> byEntity = new LinkedHashMap<>();
        private int saves;

        MapRecord add(MapRecord record) {
            byEntity.computeIfAbsent(record.entity(), e -> new ArrayList<>()).add(record);
            return record;
        }

        int saves() {
            return saves;
        }

        @Override
        public List<TargetRecord> findCandidates(String entity) {
            return List.copyOf(byEntity.getOrDefault(entity, List.of()));
        }

        @Override
        public void save(TargetRecord record, ChangeContext context) {
            saves++;
            record.set(record.entity() + ".updated_at", context.at());
            record.set(record.entity() + ".updated_by_id", context.actorId());
        }
    }

    static final class JobStoreStub implements AutomationJobStore {
        private final Map<String, AutomationJob> jobs = new LinkedHashMap<>();

        void put(AutomationJob job) {
            jobs.put(job.id(), job);
        }

        AutomationJob get(String id) {
            return jobs.get(id);
        }

        @Override
        public List<AutomationJob> findActive() {
            return jobs.values().stream().filter(AutomationJob::active).toList();
        }

        @Override
        public void markRun(String jobId, Instant lastRunAt) {
            jobs.computeIfPresent(jobId, (id, job) -> job.withLastRunAt(lastRunAt));
        }
    }
}
