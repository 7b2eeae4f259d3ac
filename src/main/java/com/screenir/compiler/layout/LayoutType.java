package com.screenir.compiler.layout;

public enum LayoutType {
    ROW,
    COLUMN,
    /**
     * Overlapping, z-ordered children.
     */
    STACK,
    /**
     * Leaves and arrangements that fit no flow pattern.
     */
    ABSOLUTE;

    public boolean isFlow() {
        return this == ROW || this == COLUMN;
    }
}
