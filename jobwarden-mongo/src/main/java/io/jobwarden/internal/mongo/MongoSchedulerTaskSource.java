package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.SchedulerTask;
import io.jobwarden.monitor.SchedulerTaskSource;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import static io.jobwarden.internal.mongo.MongoQueries.flag;
import static io.jobwarden.internal.mongo.MongoQueries.instant;
import static io.jobwarden.internal.mongo.MongoQueries.number;
import static io.jobwarden.internal.mongo.MongoQueries.string;

/**
 * Reads the {@code schedulers} collection: {@code {method, active, period (seconds), last_run}}.
 */
public class MongoSchedulerTaskSource implements SchedulerTaskSource {
    public static final String COLLECTION = "schedulers";

    private final MongoTemplate mongoTemplate;

    public MongoSchedulerTaskSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<SchedulerTask> findActive() {
        Query q = new Query(Criteria.where("active").is(true));
        return MongoQueries.read(COLLECTION, () -> mongoTemplate.find(q, Document.class, COLLECTION).stream()
                .map(doc -> new SchedulerTask(
                        string(doc, "method"),
                        flag(doc, "active"),
                        doc.get("period") == null ? null : Duration.ofSeconds(number(doc, "period")),
                        instant(doc, "last_run")))
                .toList());
    }
}
