package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.SystemStatus;
import io.jobwarden.monitor.SystemStatusSource;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects usage figures: agent count and last login from {@code users}, count and newest
 * {@code created_at} of each configured collection, database size from {@code dbStats}.
 */
public class MongoSystemStatusSource implements SystemStatusSource {
    private static final Logger log = LoggerFactory.getLogger(MongoSystemStatusSource.class);

    public static final String USERS = "users";
    public static final String AGENT_ROLE = "Agent";

    private final MongoTemplate mongoTemplate;
    private final List<String> collections;

    public MongoSystemStatusSource(MongoTemplate mongoTemplate, List<String> collections) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collections = List.copyOf(Objects.requireNonNull(collections, "collections must not be null"));
    }

    @Override
    public SystemStatus current() {
        long agents = MongoQueries.read(USERS, () -> mongoTemplate.count(
                new Query(Criteria.where("active").is(true).and("roles").is(AGENT_ROLE)), USERS));

        Instant lastLogin = newest(USERS, "last_login");

        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, Instant> lastCreatedAt = new LinkedHashMap<>();
        for (String collection : collections) {
            counts.put(collection, MongoQueries.read(collection, () -> mongoTemplate.count(new Query(), collection)));
            Instant created = newest(collection, "created_at");
            if (created != null) {
                lastCreatedAt.put(collection, created);
            }
        }

        return new SystemStatus(agents, lastLogin, counts, lastCreatedAt, storageBytes());
    }

    private Instant newest(String collection, String field) {
        Query q = new Query(Criteria.where(field).ne(null));
        q.with(Sort.by(Sort.Order.desc(field)));
        q.fields().include(field);

        Document doc = MongoQueries.read(collection, () -> mongoTemplate.findOne(q, Document.class, collection));
        return doc == null ? null : MongoQueries.instant(doc, field);
    }

    // null where the deployment does not allow dbStats
    private Long storageBytes() {
        try {
            Document stats = mongoTemplate.executeCommand(new Document("dbStats", 1));
            Object size = stats.get("storageSize");
            return size instanceof Number n ? n.longValue() : null;
        } catch (DataAccessException e) {
            log.debug("jobwarden dbStats unavailable msg={}", e.getMessage());
            return null;
        }
    }
}
