package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.ChannelSource;
import io.jobwarden.monitor.ChannelStatus;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.jobwarden.internal.mongo.MongoQueries.flag;
import static io.jobwarden.internal.mongo.MongoQueries.instant;
import static io.jobwarden.internal.mongo.MongoQueries.string;

/**
 * Reads the {@code channels} collection:
 * {@code {area, active, status_in, status_out, last_log_in, last_log_out, options, last_fetch}}.
 */
public class MongoChannelSource implements ChannelSource {
    public static final String COLLECTION = "channels";

    private final MongoTemplate mongoTemplate;

    public MongoChannelSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ChannelStatus> findActive() {
        Query q = new Query(Criteria.where("active").is(true));
        q.with(Sort.by(Sort.Order.asc("_id")));

        return MongoQueries.read(COLLECTION, () -> {
            List<ChannelStatus> out = new ArrayList<>();
            for (Document doc : mongoTemplate.find(q, Document.class, COLLECTION)) {
                out.add(toStatus(doc));
            }
            return out;
        });
    }

    private static ChannelStatus toStatus(Document doc) {
        Map<String, Object> options = doc.get("options") instanceof Document o ? o : Map.of();
        return new ChannelStatus(
                string(doc, "area"),
                flag(doc, "active"),
                string(doc, "status_in"),
                string(doc, "status_out"),
                string(doc, "last_log_in"),
                string(doc, "last_log_out"),
                options,
                instant(doc, "last_fetch")
        );
    }
}
