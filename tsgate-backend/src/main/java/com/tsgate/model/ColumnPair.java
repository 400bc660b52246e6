package com.tsgate.model;

import java.time.Instant;
import java.util.List;

/**
 * Two parallel columns ready for charting. Both lists always have the same length.
 *
 * @param timestamps sample times, ascending as returned by the store
 * @param values sample values, every element of {@code kind}'s Java type
 * @param kind the element kind inferred from the first row
 */
public record ColumnPair(List<Instant> timestamps, List<?> values, ValueKind kind) {

    public int size() {
        return timestamps.size();
    }
}
