package com.tsgate.api;

import com.tsgate.model.ColumnPair;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataFrame {
    public static final String DEFAULT_NAME = "response";

    private String name;
    private List<Field> fields;

    /**
     * Render columns as a {@code time} field and a {@code values} field.
     */
    public static DataFrame of(ColumnPair columns) {
        return new DataFrame(DEFAULT_NAME, List.of(
                new Field("time", "time", columns.timestamps()),
                new Field("values", columns.kind().wireName(), columns.values())
        ));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Field {
        private String name;
        private String type;
        private List<?> values;
    }
}
