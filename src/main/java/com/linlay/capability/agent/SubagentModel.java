package com.linlay.capability.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum SubagentModel {
    INHERIT("inherit"),
    HAIKU("haiku"),
    SONNET("sonnet"),
    OPUS("opus");

    private final String value;

    SubagentModel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<SubagentModel> fromValue(String value) {
        return Arrays.stream(values())
                .filter(model -> model.value.equals(value))
                .findFirst();
    }
}
