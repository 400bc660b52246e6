package com.tsgate.service;

import com.tsgate.api.LabelValue;
import com.tsgate.api.MetricDescriptor;
import com.tsgate.api.MetricsRequest;
import com.tsgate.api.TagOption;
import com.tsgate.model.PayloadType;
import com.tsgate.model.StoreQuery;
import com.tsgate.store.MetricStore;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonValue;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Discovers queryable metrics and their tag values straight from the store.
 *
 * <p>Two phases per call: list the time-series collections, then query each one for the tag keys of
 * its most recent document and the distinct values of every key. Nothing is cached between calls.
 * A store failure on any collection fails the whole call.
 */
@Slf4j
@Service
public class SchemaDiscoveryService {

    static final String TIMESERIES_TYPE = "timeseries";
    static final String TAGS_FIELD = "tags";

    private final MetricStore metricStore;
    private final String placeholder;

    public SchemaDiscoveryService(MetricStore metricStore,
                                  @Value("${tsgate.discovery.placeholder:select a value}") String placeholder) {
        this.metricStore = metricStore;
        this.placeholder = placeholder;
    }

    /**
     * Describe every time-series collection.
     *
     * @param request metric request; its payload is not used
     * @return one descriptor per time-series collection, in listing order
     * @throws com.tsgate.store.StoreUnavailableException if any store call fails
     */
    public List<MetricDescriptor> discover(MetricsRequest request) {
        log.debug("discovering metrics (metric={})", request != null ? request.getMetric() : null);

        List<MetricDescriptor> descriptors = new ArrayList<>();
        for (Document collection : metricStore.listCollections()) {
            if (!TIMESERIES_TYPE.equals(collection.get("type"))) {
                continue;
            }
            if (!(collection.get("name") instanceof String name)) {
                continue;
            }

            List<TagOption> tagOptions = new ArrayList<>();
            for (String tag : latestTagKeys(name)) {
                tagOptions.add(TagOption.builder()
                        .key(tag)
                        .type(PayloadType.SELECT)
                        .placeHolder(placeholder)
                        .valueOptions(distinctOptions(name, tag))
                        .build());
            }
            descriptors.add(MetricDescriptor.builder().name(name).tagOptions(tagOptions).build());
        }

        log.debug("discovered {} metrics", descriptors.size());
        return descriptors;
    }

    List<String> latestTagKeys(String collection) {
        List<Document> latest = metricStore.find(collection, latestTagsQuery());
        if (latest.isEmpty()) {
            log.debug("collection {} holds no documents", collection);
            return List.of();
        }

        Object tags = latest.get(0).get(TAGS_FIELD);
        if (!(tags instanceof Map<?, ?> tagMap)) {
            log.debug("latest document of {} carries no tag bag: {}", collection, tags);
            return List.of();
        }

        List<String> keys = new ArrayList<>(tagMap.size());
        for (Object key : tagMap.keySet()) {
            keys.add(String.valueOf(key));
        }
        log.debug("discovered tag keys for {}: {}", collection, keys);
        return keys;
    }

    List<LabelValue> distinctOptions(String collection, String tag) {
        List<BsonValue> values = metricStore.distinct(collection, TAGS_FIELD + "." + tag);
        log.debug("distinct values for tag {} of {}: {}", tag, collection, values);

        List<LabelValue> options = new ArrayList<>();
        for (BsonValue value : values) {
            toLabels(value).ifPresentOrElse(options::addAll,
                    () -> log.debug("no label for distinct value {} of type {}", value, value.getBsonType()));
        }
        return options;
    }

    static StoreQuery latestTagsQuery() {
        return new StoreQuery(
                new BsonDocument(),
                new BsonDocument(TAGS_FIELD, new BsonInt32(1)).append(RangeQueryBuilder.ID_FIELD, new BsonInt32(0)),
                new BsonDocument(RangeQueryBuilder.TIMESTAMP_FIELD, new BsonInt32(-1)),
                1);
    }

    private static Optional<List<LabelValue>> toLabels(BsonValue value) {
        if (value.isString()) {
            return Optional.of(List.of(LabelValue.of(value.asString().getValue())));
        }
        if (value.isDocument()) {
            List<LabelValue> labels = new ArrayList<>();
            for (String key : value.asDocument().keySet()) {
                labels.add(LabelValue.of(key));
            }
            return Optional.of(labels);
        }
        return Optional.empty();
    }
}
