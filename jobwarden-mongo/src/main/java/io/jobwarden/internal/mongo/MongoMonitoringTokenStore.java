package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.MonitoringTokenStore;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the monitoring token in the {@code settings} collection under {@code monitoring_token}.
 */
public class MongoMonitoringTokenStore implements MonitoringTokenStore {
    public static final String COLLECTION = "settings";
    public static final String KEY = "monitoring_token";

    private static final int TOKEN_BYTES = 64;

    private final MongoTemplate mongoTemplate;
    private final SecureRandom random = new SecureRandom();

    public MongoMonitoringTokenStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<String> currentToken() {
        Document doc = MongoQueries.read(COLLECTION, () -> mongoTemplate.findById(KEY, Document.class, COLLECTION));
        if (doc == null) {
            return Optional.empty();
        }
        String value = MongoQueries.string(doc, "value");
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public String rotate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        Update u = new Update()
                .set("value", token)
                .set("updated_at", Instant.now());
        mongoTemplate.upsert(new Query(Criteria.where("_id").is(KEY)), u, COLLECTION);
        return token;
    }
}
