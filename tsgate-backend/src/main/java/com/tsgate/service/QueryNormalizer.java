package com.tsgate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsgate.model.BuilderQueryModel;
import com.tsgate.model.CanonicalQuery;
import com.tsgate.model.CodeQueryModel;
import com.tsgate.model.ModeDiscriminator;
import com.tsgate.model.QueryPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the descriptor a panel sends into a {@link CanonicalQuery}.
 *
 * <p>The descriptor comes in two shapes selected by {@code editorMode}. Only the discriminator is
 * read first; the matching shape is then bound in full. Builder mode carries a structured payload,
 * every other mode is treated as code mode, whose payload is a JSON document encoded as a string.
 */
@Slf4j
@Service
public class QueryNormalizer {

    private final ObjectMapper objectMapper;

    public QueryNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Normalize raw descriptor text.
     *
     * @param rawQuery descriptor JSON
     * @return canonical query
     * @throws MalformedQueryException if the descriptor or its payload is not valid JSON
     */
    public CanonicalQuery normalize(String rawQuery) {
        JsonNode node;
        try {
            node = objectMapper.readTree(rawQuery);
        } catch (JsonProcessingException e) {
            log.error("error unmarshalling the query descriptor: {}", e.getOriginalMessage());
            throw new MalformedQueryException("json unmarshal: " + e.getOriginalMessage(), e);
        }
        return normalize(node);
    }

    /**
     * Normalize an already parsed descriptor.
     *
     * @param query descriptor tree
     * @return canonical query
     * @throws MalformedQueryException if the descriptor does not match its declared shape
     */
    public CanonicalQuery normalize(JsonNode query) {
        if (query == null || !query.isObject()) {
            throw new MalformedQueryException("json unmarshal: query descriptor must be a JSON object", null);
        }

        ModeDiscriminator mode = bind(query, ModeDiscriminator.class, "mode teller");
        CanonicalQuery canonical = mode.isBuilder() ? fromBuilder(query) : fromCode(query);
        log.debug("parsed {} query: {}", mode.isBuilder() ? ModeDiscriminator.BUILDER : ModeDiscriminator.CODE, canonical);
        return canonical;
    }

    private CanonicalQuery fromBuilder(JsonNode query) {
        BuilderQueryModel model = bind(query, BuilderQueryModel.class, "builder-mode query");
        return toCanonical(model.getTarget(), model.getPayload(), model.getMaxDataPoints());
    }

    private CanonicalQuery fromCode(JsonNode query) {
        CodeQueryModel model = bind(query, CodeQueryModel.class, "code-mode query");

        QueryPayload payload;
        String rawPayload = model.getPayload();
        if (rawPayload == null || rawPayload.isBlank()) {
            payload = new QueryPayload();
        } else {
            try {
                payload = objectMapper.readValue(rawPayload, QueryPayload.class);
            } catch (JsonProcessingException e) {
                log.error("error unmarshalling the code-mode payload: {}", e.getOriginalMessage());
                throw new MalformedQueryException("json unmarshal: " + e.getOriginalMessage(), e);
            }
        }
        return toCanonical(model.getTarget(), payload, model.getMaxDataPoints());
    }

    private CanonicalQuery toCanonical(String target, QueryPayload payload, long maxDataPoints) {
        if (target == null || target.isBlank()) {
            throw new MalformedQueryException("query has no target collection", null);
        }
        QueryPayload resolved = payload != null ? payload : new QueryPayload();
        String findQuery = resolved.getFindQuery() != null ? resolved.getFindQuery() : "";
        return new CanonicalQuery(target, findQuery, resolved.getProjection(), maxDataPoints);
    }

    private <T> T bind(JsonNode query, Class<T> type, String what) {
        try {
            T bound = objectMapper.treeToValue(query, type);
            if (bound == null) {
                throw new MalformedQueryException("json unmarshal: empty " + what, null);
            }
            return bound;
        } catch (JsonProcessingException e) {
            log.error("error unmarshalling the {}: {}", what, e.getOriginalMessage());
            throw new MalformedQueryException("json unmarshal: " + e.getOriginalMessage(), e);
        }
    }
}
