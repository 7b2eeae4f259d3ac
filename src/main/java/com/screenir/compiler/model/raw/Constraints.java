package com.screenir.compiler.model.raw;

import lombok.Value;

/**
 * Resize constraints relative to the parent frame.
 */
@Value
public class Constraints {

    public enum Horizontal {
        LEFT,
        RIGHT,
        CENTER,
        LEFT_RIGHT,
        SCALE
    }

    public enum Vertical {
        TOP,
        BOTTOM,
        CENTER,
        TOP_BOTTOM,
        SCALE
    }

    Horizontal horizontal;
    Vertical vertical;
}
