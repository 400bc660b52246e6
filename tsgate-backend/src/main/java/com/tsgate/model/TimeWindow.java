package com.tsgate.model;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Inclusive {@code [from, to]} bounds applied to every query. Ordering is not checked here.
 */
public record TimeWindow(
        @NotNull(message = "timeRange.from is required") Instant from,
        @NotNull(message = "timeRange.to is required") Instant to) {
}
