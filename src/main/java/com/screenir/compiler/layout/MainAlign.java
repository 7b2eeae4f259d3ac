package com.screenir.compiler.layout;

public enum MainAlign {
    START,
    CENTER,
    END,
    SPACE_BETWEEN,
    SPACE_AROUND
}
