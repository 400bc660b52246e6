package com.tsgate.service;

import com.tsgate.model.ColumnPair;
import com.tsgate.model.TypedColumn;
import com.tsgate.model.ValueKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts loosely typed rows into a timestamp column and a single-kind value column.
 *
 * <p>The value kind is decided by the projected value of the first row. Later rows whose
 * timestamp is not a recognised timestamp, or whose value is missing or of another kind, are
 * dropped so both columns stay aligned and homogeneous.
 */
@Slf4j
@Service
public class ColumnarAssembler {

    /**
     * Assemble rows into columns.
     *
     * @param rows rows in store order
     * @param projectionField field holding the sample value
     * @return aligned columns
     * @throws NoDataException if there are no rows or the first row's value has no usable kind
     */
    public ColumnPair assemble(List<? extends Map<String, Object>> rows, String projectionField) {
        if (rows == null || rows.isEmpty()) {
            throw new NoDataException("got no fields back...");
        }

        Object sample = rows.get(0).get(projectionField);
        ValueKind kind = ValueKind.infer(sample).orElseThrow(() -> new NoDataException(
                "can't infer a value type: first row has no usable '" + projectionField + "' value"));
        log.debug("detected value kind {} from sample {}", kind, sample);

        return fill(TypedColumn.forKind(kind, rows.size()), rows, projectionField);
    }

    private <T> ColumnPair fill(TypedColumn<T> column, List<? extends Map<String, Object>> rows, String projectionField) {
        List<Instant> timestamps = new ArrayList<>(rows.size());
        int index = 0;
        for (Map<String, Object> row : rows) {
            Instant timestamp = ValueKind.toInstant(row.get(RangeQueryBuilder.TIMESTAMP_FIELD));
            T value = column.accept(row.get(projectionField));
            if (timestamp == null || value == null) {
                log.debug("skipping row {}: timestamp={}, value={}", index, row.get(RangeQueryBuilder.TIMESTAMP_FIELD),
                        row.get(projectionField));
            } else {
                timestamps.add(timestamp);
                column.append(value);
            }
            index++;
        }

        log.debug("assembled {} of {} rows into a {} column", column.size(), rows.size(), column.getKind());
        return new ColumnPair(timestamps, column.getValues(), column.getKind());
    }
}
