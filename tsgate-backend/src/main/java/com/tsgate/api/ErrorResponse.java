package com.tsgate.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    public static final String MALFORMED_QUERY = "MALFORMED_QUERY";
    public static final String NO_DATA = "NO_DATA";
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

    private String code;
    private String message;
    private String details;
    private String traceId;
}
