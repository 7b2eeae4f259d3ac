package com.screenir.compiler.ir;

public enum ButtonVariant {
    PRIMARY,
    SECONDARY,
    OUTLINE,
    GHOST
}
