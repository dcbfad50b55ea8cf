package io.jobwarden.internal.mongo;

import io.jobwarden.monitor.ImportJobRecord;
import io.jobwarden.monitor.ImportJobSource;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;

import static io.jobwarden.internal.mongo.MongoQueries.flag;
import static io.jobwarden.internal.mongo.MongoQueries.instant;
import static io.jobwarden.internal.mongo.MongoQueries.string;

/**
 * Reads the {@code import_jobs} collection:
 * {@code {name, dry_run, started_at, finished_at, updated_at, result: {error}}}.
 */
public class MongoImportJobSource implements ImportJobSource {
    public static final String COLLECTION = "import_jobs";

    private final MongoTemplate mongoTemplate;

    public MongoImportJobSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ImportJobRecord> findByName(String backend) {
        Objects.requireNonNull(backend, "backend must not be null");
        Query q = new Query(Criteria.where("name").is(backend).and("dry_run").ne(true));
        q.with(Sort.by(Sort.Order.asc("started_at")));

        return MongoQueries.read(COLLECTION, () -> mongoTemplate.find(q, Document.class, COLLECTION).stream()
                .map(MongoImportJobSource::toRecord)
                .toList());
    }

    private static ImportJobRecord toRecord(Document doc) {
        String error = doc.get("result") instanceof Document result ? string(result, "error") : null;
        return new ImportJobRecord(
                String.valueOf(doc.get("_id")),
                string(doc, "name"),
                flag(doc, "dry_run"),
                instant(doc, "started_at"),
                instant(doc, "finished_at"),
                instant(doc, "updated_at"),
                error
        );
    }
}
