package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.CreatedRecordCounter;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.Objects;

/**
 * Counts documents of one collection by {@code created_at}.
 */
public class MongoCreatedRecordCounter implements CreatedRecordCounter {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoCreatedRecordCounter(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    @Override
    public long countCreatedBetween(Instant from, Instant to) {
        Query q = new Query(Criteria.where("created_at").gte(from).lte(to));
        return MongoQueries.read(collection, () -> mongoTemplate.count(q, collection));
    }
}
