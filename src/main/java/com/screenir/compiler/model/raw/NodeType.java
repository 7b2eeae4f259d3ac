package com.screenir.compiler.model.raw;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Node type tags used by the design tool's document schema.
 */
public enum NodeType {
    DOCUMENT,
    CANVAS,
    FRAME,
    GROUP,
    SECTION,
    VECTOR,
    BOOLEAN_OPERATION,
    STAR,
    LINE,
    ELLIPSE,
    REGULAR_POLYGON,
    RECTANGLE,
    TEXT,
    SLICE,
    COMPONENT,
    COMPONENT_SET,
    INSTANCE,
    STICKY,
    SHAPE_WITH_TEXT,
    CONNECTOR,
    UNKNOWN;

    private static final Set<NodeType> VECTOR_PRIMITIVES = EnumSet.of(
            VECTOR, BOOLEAN_OPERATION, STAR, LINE, ELLIPSE, REGULAR_POLYGON);

    /**
     * Vector/path primitives rendered as SVG-like shapes.
     */
    public boolean isVectorPrimitive() {
        return VECTOR_PRIMITIVES.contains(this);
    }

    public boolean isFrameOrGroup() {
        return this == FRAME || this == GROUP;
    }

    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
