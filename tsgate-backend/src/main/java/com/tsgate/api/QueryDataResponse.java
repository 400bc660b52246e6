package com.tsgate.api;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-query results keyed by {@code refId}, in request order.
 */
@Data
public class QueryDataResponse {
    private Map<String, DataResponse> responses = new LinkedHashMap<>();
}
