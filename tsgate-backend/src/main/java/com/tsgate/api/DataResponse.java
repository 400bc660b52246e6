package com.tsgate.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a single query: frames on success, an error otherwise. {@code status} follows HTTP
 * semantics (200, 400 malformed input, 404 no data, 502 store unavailable).
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataResponse {
    private int status;
    private List<DataFrame> frames;
    private ErrorResponse error;

    public static DataResponse ok(DataFrame frame) {
        return DataResponse.builder().status(200).frames(List.of(frame)).build();
    }

    public static DataResponse error(int status, ErrorResponse error) {
        return DataResponse.builder().status(status).error(error).build();
    }
}
