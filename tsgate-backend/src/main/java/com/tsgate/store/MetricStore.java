package com.tsgate.store;

import com.tsgate.model.StoreQuery;
import org.bson.BsonValue;
import org.bson.Document;

import java.util.List;

/**
 * Read-only view of the document store holding the metric collections.
 *
 * <p>Implementations must be safe for concurrent use; every failure is reported as a
 * {@link StoreUnavailableException}.
 */
public interface MetricStore {

    /**
     * Run a find against one collection.
     *
     * @param collection collection name
     * @param query filter, projection, sort and limit
     * @return matching documents in store order
     */
    List<Document> find(String collection, StoreQuery query);

    /**
     * List collection metadata documents ({@code name}, {@code type}, {@code options}, ...).
     */
    List<Document> listCollections();

    /**
     * Distinct values of a (possibly dotted) field across a whole collection.
     */
    List<BsonValue> distinct(String collection, String fieldPath);

    /**
     * Round trip to the server.
     */
    void ping();
}
