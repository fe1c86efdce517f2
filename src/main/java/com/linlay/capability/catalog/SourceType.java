package com.linlay.capability.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
    PROJECT("project"),
    PROJECT_CLAUDE("project-claude"),
    USER("user"),
    PROGRAMMATIC("programmatic");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
