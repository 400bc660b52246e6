package com.tsgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModeDiscriminator {
    public static final String BUILDER = "builder";
    public static final String CODE = "code";

    private String editorMode;

    public boolean isBuilder() {
        return BUILDER.equals(editorMode);
    }
}
