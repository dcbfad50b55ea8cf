package io.jobwarden.internal.mongo;

import io.jobwarden.RecordStore;
import io.jobwarden.TargetRecord;
import io.jobwarden.core.ChangeContext;
import io.jobwarden.core.JobConfigurationException;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes automation targets in the collections mapped per entity
 * (e.g. {@code ticket -> tickets}).
 *
 * <p>Saving sets the changed fields plus {@code updated_at} and {@code updated_by_id}.
 */
public class MongoRecordStore implements RecordStore {

    public static final String UPDATED_AT = "updated_at";
    public static final String UPDATED_BY = "updated_by_id";

    private final MongoTemplate mongoTemplate;
    private final Map<String, String> entityCollections;

    public MongoRecordStore(MongoTemplate mongoTemplate, Map<String, String> entityCollections) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.entityCollections = Map.copyOf(Objects.requireNonNull(entityCollections, "entityCollections must not be null"));
    }

    @Override
    public List<TargetRecord> findCandidates(String entity) {
        String collection = collectionFor(entity);
        Query q = new Query();
        q.with(Sort.by(Sort.Order.asc("_id")));

        List<TargetRecord> records = new ArrayList<>();
        for (Document doc : mongoTemplate.find(q, Document.class, collection)) {
            records.add(new DocumentTargetRecord(entity, doc));
        }
        return records;
    }

    @Override
    public void save(TargetRecord record, ChangeContext context) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (!(record instanceof DocumentTargetRecord doc)) {
            throw new IllegalArgumentException("record was not loaded by this store: " + record.getClass().getName());
        }

        Update u = new Update();
        doc.changes().forEach(u::set);
        u.set(UPDATED_AT, context.at());
        u.set(UPDATED_BY, context.actorId());

        Query q = new Query(Criteria.where("_id").is(doc.rawId()));
        mongoTemplate.updateFirst(q, u, collectionFor(doc.entity()));
        doc.clearChanges();
    }

    String collectionFor(String entity) {
        String collection = entityCollections.get(entity);
        if (collection == null) {
            throw new JobConfigurationException("No collection mapped for entity '" + entity + "'");
        }
        return collection;
    }
}
