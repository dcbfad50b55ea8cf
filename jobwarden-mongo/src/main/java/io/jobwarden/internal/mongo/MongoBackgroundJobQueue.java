package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.BackgroundJobQueue;
import io.jobwarden.monitor.BackgroundJobRecord;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static io.jobwarden.internal.mongo.MongoQueries.instant;
import static io.jobwarden.internal.mongo.MongoQueries.number;
import static io.jobwarden.internal.mongo.MongoQueries.string;

/**
 * Statistics over the {@code delayed_jobs} collection of the background queue runtime:
 * {@code {payload_type, attempts, last_error, created_at, run_at, failed_at}}.
 */
public class MongoBackgroundJobQueue implements BackgroundJobQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoBackgroundJobQueue.class);

    public static final String COLLECTION = "delayed_jobs";

    private final MongoTemplate mongoTemplate;

    public MongoBackgroundJobQueue(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public long countCreatedBefore(Instant createdBefore) {
        Query q = new Query(Criteria.where("created_at").lt(createdBefore));
        return MongoQueries.read(COLLECTION, () -> mongoTemplate.count(q, COLLECTION));
    }

    @Override
    public long countFailing(int retryCeiling) {
        return MongoQueries.read(COLLECTION, () -> mongoTemplate.count(failing(retryCeiling), COLLECTION));
    }

    @Override
    public List<BackgroundJobRecord> findFailing(int retryCeiling, int limit) {
        Query q = failing(retryCeiling);
        q.with(Sort.by(Sort.Order.asc("_id")));
        q.limit(limit);

        return MongoQueries.read(COLLECTION, () -> mongoTemplate.find(q, Document.class, COLLECTION).stream()
                .map(doc -> new BackgroundJobRecord(
                        String.valueOf(doc.get("_id")),
                        string(doc, "payload_type"),
                        (int) number(doc, "attempts"),
                        string(doc, "last_error"),
                        instant(doc, "created_at")))
                .toList());
    }

    @Override
    public long requeueFailing(int retryCeiling) {
        Update u = new Update()
                .set("attempts", 0)
                .set("run_at", Instant.now())
                .unset("failed_at")
                .unset("locked_at")
                .unset("locked_by");

        long modified = mongoTemplate.updateMulti(failing(retryCeiling), u, COLLECTION).getModifiedCount();
        log.info("jobwarden requeued failing background jobs count={}", modified);
        return modified;
    }

    private static Query failing(int retryCeiling) {
        return new Query(Criteria.where("attempts").gt(retryCeiling));
    }
}
