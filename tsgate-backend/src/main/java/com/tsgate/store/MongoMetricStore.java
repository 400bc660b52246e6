package com.tsgate.store;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoDatabase;
import com.tsgate.model.StoreQuery;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonValue;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class MongoMetricStore implements MetricStore {

    private final MongoDatabase database;
    private final long queryTimeoutMs;

    /**
     * Create a store bound to one database.
     *
     * @param database database holding the metric collections
     * @param queryTimeoutMs server-side time limit for each find, 0 disables it
     */
    public MongoMetricStore(MongoDatabase database,
                            @Value("${tsgate.mongo.query-timeout-ms:30000}") long queryTimeoutMs) {
        this.database = database;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    @Override
    public List<Document> find(String collection, StoreQuery query) {
        log.debug("find on {}: filter={}, projection={}, sort={}, limit={}",
                collection, query.filter(), query.projection(), query.sort(), query.limit());
        try {
            FindIterable<Document> cursor = database.getCollection(collection)
                    .find(query.filter())
                    .projection(query.projection())
                    .sort(query.sort())
                    .limit(query.limit());
            if (queryTimeoutMs > 0) {
                cursor = cursor.maxTime(queryTimeoutMs, TimeUnit.MILLISECONDS);
            }
            return cursor.into(new ArrayList<>());
        } catch (MongoException e) {
            log.warn("find on collection {} failed: {}", collection, e.getMessage());
            throw new StoreUnavailableException("find on " + collection + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Document> listCollections() {
        try {
            return database.listCollections().into(new ArrayList<>());
        } catch (MongoException e) {
            log.error("Failed to list collections of {}", database.getName(), e);
            throw new StoreUnavailableException("couldn't retrieve the collections: " + e.getMessage(), e);
        }
    }

    @Override
    public List<BsonValue> distinct(String collection, String fieldPath) {
        try {
            return database.getCollection(collection)
                    .distinct(fieldPath, BsonValue.class)
                    .into(new ArrayList<>());
        } catch (MongoException e) {
            log.error("distinct({}) on collection {} failed", fieldPath, collection, e);
            throw new StoreUnavailableException(
                    "couldn't compute distinct values of " + fieldPath + " on " + collection + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ping() {
        try {
            database.runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            throw new StoreUnavailableException(e.getMessage(), e);
        }
    }
}
