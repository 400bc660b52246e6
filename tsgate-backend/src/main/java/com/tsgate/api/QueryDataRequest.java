package com.tsgate.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QueryDataRequest {
    @Valid
    @NotEmpty(message = "At least one query is required")
    private List<DataQuery> queries = new ArrayList<>();
}
