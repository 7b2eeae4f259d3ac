package com.screenir.compiler.styles;

public enum Position {
    ABSOLUTE,
    RELATIVE
}
