package com.tsgate.model;

import org.bson.BsonDocument;

/**
 * A find request ready for the store: filter, projection, sort and row cap.
 *
 * @param filter match expression
 * @param projection fields to return
 * @param sort ordering
 * @param limit maximum rows, 0 for no limit
 */
public record StoreQuery(BsonDocument filter, BsonDocument projection, BsonDocument sort, int limit) {
}
