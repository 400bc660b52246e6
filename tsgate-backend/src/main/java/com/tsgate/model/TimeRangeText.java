package com.tsgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RFC 3339 encoded window as echoed by the panel inside the descriptor.
 *
 * <p>Informational only; the window that bounds a query is the one sent next to the descriptor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeRangeText {
    private String from;
    private String to;
}
