package com.tsgate.api;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Body of the {@code metrics} resource call. {@code payload} is accepted but not used yet.
 */
@Data
public class MetricsRequest {
    private String metric;
    private Map<String, String> payload = new HashMap<>();
}
