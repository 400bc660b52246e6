package com.tsgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Descriptor produced by the code editor. {@code payload} holds a JSON document encoded as a string.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeQueryModel {
    private String target;
    private String payload;
    private int intervalMs;
    private long maxDataPoints;
    private TimeRangeText timeRange;
}
