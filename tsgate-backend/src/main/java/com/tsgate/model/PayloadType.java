package com.tsgate.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Widget the panel renders for a tag option list.
 */
public enum PayloadType {
    SELECT("select"),
    MULTI_SELECT("multi-select"),
    INPUT("input"),
    TEXTAREA("textarea");

    private final String wireName;

    PayloadType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
