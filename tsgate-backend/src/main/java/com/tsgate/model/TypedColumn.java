package com.tsgate.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growable column whose element type is fixed by its {@link ValueKind}.
 *
 * @param <T> Java type of the elements
 */
public final class TypedColumn<T> {
    private final ValueKind kind;
    private final Class<T> type;
    private final List<T> values;

    private TypedColumn(ValueKind kind, Class<T> type, int expectedSize) {
        this.kind = kind;
        this.type = type;
        this.values = new ArrayList<>(expectedSize);
    }

    public static TypedColumn<?> forKind(ValueKind kind, int expectedSize) {
        return new TypedColumn<>(kind, kind.getJavaType(), expectedSize);
    }

    /**
     * Coerces a raw value without appending it.
     *
     * @return the coerced element, or null if the raw value does not belong to this column's kind
     */
    public T accept(Object raw) {
        Object coerced = kind.coerce(raw);
        return coerced != null ? type.cast(coerced) : null;
    }

    public void append(T value) {
        values.add(value);
    }

    public ValueKind getKind() {
        return kind;
    }

    public List<T> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }
}
