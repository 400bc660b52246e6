package com.tsgate.model;

/**
 * Normalized form of a panel query, independent of the editor mode that produced it.
 *
 * @param collection time-series collection the query targets
 * @param findQueryText free-form filter text, possibly blank
 * @param projectionField the single field returned as the value column
 * @param maxPoints cap carried by the descriptor itself
 */
public record CanonicalQuery(String collection, String findQueryText, String projectionField, long maxPoints) {

    public boolean hasFilter() {
        return findQueryText != null && !findQueryText.isBlank();
    }

    public boolean hasProjection() {
        return projectionField != null && !projectionField.isBlank();
    }
}
