package com.tsgate.service;

import com.tsgate.model.CanonicalQuery;
import com.tsgate.model.StoreQuery;
import com.tsgate.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonArray;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Turns a {@link CanonicalQuery} into a find bounded by a time window and a row cap.
 *
 * <p>The final filter is {@code {$and: [lower bound, upper bound, user clauses...]}}. Each top-level
 * key of the user filter becomes its own clause so nothing the user wrote can collide with the
 * window; a user {@code timestamp} clause is kept next to the system ones.
 */
@Slf4j
@Service
public class RangeQueryBuilder {

    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String ID_FIELD = "_id";

    /**
     * Build the store query.
     *
     * @param query canonical query
     * @param window inclusive time bounds
     * @param maxPoints row cap, values {@code <= 0} disable the cap
     * @return store query sorted by ascending timestamp
     * @throws MalformedQueryException if the filter text is not valid extended JSON
     */
    public StoreQuery build(CanonicalQuery query, TimeWindow window, long maxPoints) {
        BsonDocument userFilter = query.hasFilter() ? parseFilter(query.findQueryText()) : new BsonDocument();

        BsonArray clauses = new BsonArray();
        clauses.add(new BsonDocument(TIMESTAMP_FIELD,
                new BsonDocument("$gte", new BsonDateTime(window.from().toEpochMilli()))));
        clauses.add(new BsonDocument(TIMESTAMP_FIELD,
                new BsonDocument("$lte", new BsonDateTime(window.to().toEpochMilli()))));
        for (Map.Entry<String, BsonValue> clause : userFilter.entrySet()) {
            clauses.add(new BsonDocument(clause.getKey(), clause.getValue()));
        }
        BsonDocument filter = new BsonDocument("$and", clauses);

        BsonDocument projection = new BsonDocument();
        if (query.hasProjection()) {
            projection.append(query.projectionField(), new BsonInt32(1));
        }
        projection.append(TIMESTAMP_FIELD, new BsonInt32(1));
        projection.append(ID_FIELD, new BsonInt32(0));

        BsonDocument sort = new BsonDocument(TIMESTAMP_FIELD, new BsonInt32(1));

        StoreQuery built = new StoreQuery(filter, projection, sort, clampLimit(maxPoints));
        log.debug("final filter: {}", filter.toJson());
        log.debug("final projection: {}, limit: {}", projection.toJson(), built.limit());
        return built;
    }

    /**
     * Parse user filter text after rewriting single quotes to double quotes.
     *
     * <p>A literal apostrophe inside a string value is rewritten too and breaks the filter.
     */
    BsonDocument parseFilter(String findQueryText) {
        String rewritten = rewriteQuotes(findQueryText);
        try {
            return BsonDocument.parse(rewritten);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            log.warn("invalid find query {}: {}", rewritten, e.getMessage());
            throw new MalformedQueryException("invalid find query: " + e.getMessage(), e);
        }
    }

    public static String rewriteQuotes(String filter) {
        return filter.replace('\'', '"');
    }

    private static int clampLimit(long maxPoints) {
        if (maxPoints <= 0) {
            return 0;
        }
        return (int) Math.min(maxPoints, Integer.MAX_VALUE);
    }
}
