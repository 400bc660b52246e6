package com.tsgate.model;

import org.bson.BsonDateTime;
import org.bson.types.Decimal128;

import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of scalar kinds a value column can hold.
 *
 * <p>Each kind recognises the raw values the MongoDB driver decodes into and coerces them to a
 * single Java type. Coercion never crosses kinds: a {@code Double} offered to {@link #INTEGER}
 * is rejected rather than truncated.
 */
public enum ValueKind {
    INTEGER(Long.class) {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            return null;
        }
    },
    FLOAT(Double.class) {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Double || raw instanceof Float) {
                return ((Number) raw).doubleValue();
            }
            if (raw instanceof Decimal128 decimal && !decimal.isNaN() && !decimal.isInfinite()) {
                return decimal.doubleValue();
            }
            return null;
        }
    },
    STRING(String.class) {
        @Override
        public Object coerce(Object raw) {
            return raw instanceof String s ? s : null;
        }
    },
    BOOLEAN(Boolean.class) {
        @Override
        public Object coerce(Object raw) {
            return raw instanceof Boolean b ? b : null;
        }
    },
    TIMESTAMP(Instant.class) {
        @Override
        public Object coerce(Object raw) {
            return toInstant(raw);
        }
    };

    private final Class<?> javaType;

    ValueKind(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Name used for the value field type in rendered frames.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Converts a raw store value into this kind's Java type.
     *
     * @param raw decoded store value, may be null
     * @return coerced value, or null when the raw value is not of this kind
     */
    public abstract Object coerce(Object raw);

    /**
     * Picks the kind of a sample value. Empty when the sample is null or of an unsupported shape
     * (documents, arrays, binary, object ids).
     */
    public static Optional<ValueKind> infer(Object sample) {
        if (sample == null) {
            return Optional.empty();
        }
        for (ValueKind kind : values()) {
            if (kind.coerce(sample) != null) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a timestamp in any representation the driver hands back.
     *
     * @return the instant, or null if the value is not a timestamp
     */
    public static Instant toInstant(Object raw) {
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof BsonDateTime dateTime) {
            return Instant.ofEpochMilli(dateTime.getValue());
        }
        return null;
    }
}
