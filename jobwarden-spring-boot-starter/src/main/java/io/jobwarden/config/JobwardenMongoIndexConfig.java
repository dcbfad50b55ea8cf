package io.jobwarden.config;

import io.jobwarden.internal.mongo.AutomationJobDocument;
import io.jobwarden.internal.mongo.MongoBackgroundJobQueue;
import io.jobwarden.internal.mongo.MongoImportJobSource;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Collection;
import java.util.Objects;

/**
 * MongoDB index definitions used by jobwarden queries.
 *
 * <p>Indexes are not created at startup unless {@code jobwarden.ensure-indexes-on-startup=true};
 * production deployments usually manage them with migrations.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_active_name</b> on {@code automation_jobs}: { active: 1, name: 1 }
 *       <br/>Loading active job definitions per pass.</li>
 *   <li><b>idx_attempts</b> on {@code delayed_jobs}: { attempts: 1 }
 *       <br/>Counting, sampling and requeueing failing background jobs.</li>
 *   <li><b>idx_created_at</b> on {@code delayed_jobs} and on every automation target collection: { created_at: 1 }
 *       <br/>Backlog age filter, amount checks and relative date conditions.</li>
 *   <li><b>idx_name_started_at</b> on {@code import_jobs}: { name: 1, started_at: 1 }
 *       <br/>Import run lookup per backend.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.automation_jobs.createIndex({ active: 1, name: 1 }, { name: "idx_active_name" });
 * db.delayed_jobs.createIndex({ attempts: 1 }, { name: "idx_attempts" });
 * db.delayed_jobs.createIndex({ created_at: 1 }, { name: "idx_created_at" });
 * db.tickets.createIndex({ created_at: 1 }, { name: "idx_created_at" });
 * db.import_jobs.createIndex({ name: 1, started_at: 1 }, { name: "idx_name_started_at" });
 * </pre>
 */
public class JobwardenMongoIndexConfig {

    public static final String IDX_ACTIVE_NAME = "idx_active_name";
    public static final String IDX_ATTEMPTS = "idx_attempts";
    public static final String IDX_CREATED_AT = "idx_created_at";
    public static final String IDX_NAME_STARTED_AT = "idx_name_started_at";

    private final MongoTemplate mongoTemplate;
    private final Collection<String> targetCollections;

    public JobwardenMongoIndexConfig(MongoTemplate mongoTemplate, Collection<String> targetCollections) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.targetCollections = Objects.requireNonNull(targetCollections, "targetCollections must not be null");
    }

    /**
     * Create every index listed above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(AutomationJobDocument.class).ensureIndex(activeNameIndex());
        mongoTemplate.indexOps(MongoBackgroundJobQueue.COLLECTION).ensureIndex(attemptsIndex());
        mongoTemplate.indexOps(MongoBackgroundJobQueue.COLLECTION).ensureIndex(createdAtIndex());
        mongoTemplate.indexOps(MongoImportJobSource.COLLECTION).ensureIndex(nameStartedAtIndex());
        for (String collection : targetCollections) {
            mongoTemplate.indexOps(collection).ensureIndex(createdAtIndex());
        }
    }

    public static Index activeNameIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("name", Sort.Direction.ASC)
                .named(IDX_ACTIVE_NAME);
    }

    public static Index attemptsIndex() {
        return new Index()
                .on("attempts", Sort.Direction.ASC)
                .named(IDX_ATTEMPTS);
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("created_at", Sort.Direction.ASC)
                .named(IDX_CREATED_AT);
    }

    public static Index nameStartedAtIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .on("started_at", Sort.Direction.ASC)
                .named(IDX_NAME_STARTED_AT);
    }
}
