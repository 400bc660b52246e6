package com.tsgate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tsgate.model.TimeWindow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * One panel query: the descriptor written in the editor plus the window and cap the panel imposes.
 */
@Data
public class DataQuery {
    @NotBlank(message = "refId is required")
    private String refId;

    @Valid
    @NotNull(message = "timeRange is required")
    private TimeWindow timeRange;

    private long maxDataPoints;

    private long intervalMs;

    @NotNull(message = "model is required")
    private JsonNode model;
}
