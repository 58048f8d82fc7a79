package com.tennis.features.api.service;

import com.mongodb.MongoNamespace;
import com.mongodb.client.model.RenameCollectionOptions;
import com.tennis.features.api.config.FeatureEngineProperties;
import com.tennis.features.engine.model.FeatureRow;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the feature table. One document per match, keyed by match id.
 *
 * A full rebuild is written to a staging collection and renamed over the live
 * one, so readers only ever see a complete table.
 */
@Service
public class FeatureTableWriter {

    private static final Logger log = LoggerFactory.getLogger(FeatureTableWriter.class);

    private static final String STAGING_SUFFIX = "_staging";

    private final MongoTemplate mongoTemplate;
    private final FeatureEngineProperties properties;

    public FeatureTableWriter(MongoTemplate mongoTemplate, FeatureEngineProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    public void replaceAll(List<FeatureRow> rows) {
        String target = properties.getReplay().getFeatureCollection();
        String staging = target + STAGING_SUFFIX;

        if (mongoTemplate.collectionExists(staging)) {
            mongoTemplate.dropCollection(staging);
        }
        try {
            mongoTemplate.createCollection(staging);
            int batchSize = properties.getReplay().getBatchSize();
            List<Document> batch = new ArrayList<>(batchSize);
            for (FeatureRow row : rows) {
                batch.add(toDocument(row));
                if (batch.size() >= batchSize) {
                    mongoTemplate.insert(batch, staging);
                    batch = new ArrayList<>(batchSize);
                }
            }
            if (!batch.isEmpty()) {
                mongoTemplate.insert(batch, staging);
            }

            mongoTemplate.getCollection(staging).renameCollection(
                    new MongoNamespace(mongoTemplate.getDb().getName(), target),
                    new RenameCollectionOptions().dropTarget(true));
            log.info("Published {} feature rows to {}", rows.size(), target);
        } catch (RuntimeException e) {
            log.error("Writing feature table failed, dropping {}: {}", staging, e.getMessage());
            mongoTemplate.dropCollection(staging);
            throw e;
        }
    }

    /**
     * Insert or replace rows in place, used by incremental refreshes.
     */
    public void upsert(List<FeatureRow> rows) {
        if (rows.isEmpty()) return;
        String target = properties.getReplay().getFeatureCollection();

        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, target);
        for (FeatureRow row : rows) {
            Document doc = toDocument(row);
            bulk.replaceOne(Query.query(Criteria.where("_id").is(doc.get("_id"))), doc,
                    FindAndReplaceOptions.options().upsert());
        }
        bulk.execute();
        log.info("Upserted {} feature rows into {}", rows.size(), target);
    }

    public Optional<Document> findByMatchId(String matchId) {
        String target = properties.getReplay().getFeatureCollection();
        Document doc = mongoTemplate.findOne(Query.query(Criteria.where("_id").is(matchId)), Document.class, target);
        return Optional.ofNullable(doc);
    }

    public long count() {
        return mongoTemplate.getCollection(properties.getReplay().getFeatureCollection()).countDocuments();
    }

    private Document toDocument(FeatureRow row) {
        Map<String, Object> columns = row.toColumns();
        Document doc = new Document("_id", columns.get("match_id"));
        doc.putAll(columns);
        return doc;
    }
}
