package com.screenir.compiler.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Orientation {
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String value;

    Orientation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
