package com.tsgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Descriptor produced by the query builder editor. The payload is already structured.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuilderQueryModel {
    private String target;
    private QueryPayload payload = new QueryPayload();
    private int intervalMs;
    private long maxDataPoints;
    private TimeRangeText timeRange;
}
