package com.tsgate.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    public enum Status { OK, ERROR }

    private Status status;
    private String message;
}
