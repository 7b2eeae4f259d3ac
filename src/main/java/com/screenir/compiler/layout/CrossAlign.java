package com.screenir.compiler.layout;

public enum CrossAlign {
    START,
    CENTER,
    END,
    BASELINE,
    STRETCH
}
