package com.screenir.compiler.detection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StateType {
    SELECTED,
    ACTIVE,
    DISABLED,
    VARIANT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
