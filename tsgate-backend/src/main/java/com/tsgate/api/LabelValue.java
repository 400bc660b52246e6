package com.tsgate.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabelValue {
    private String label;
    private String value;

    public static LabelValue of(String value) {
        return new LabelValue(value, value);
    }
}
