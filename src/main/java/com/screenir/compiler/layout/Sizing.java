package com.screenir.compiler.layout;

/**
 * Sizing behavior along one axis.
 */
public enum Sizing {
    FIXED,
    /**
     * Fill the parent container.
     */
    FILL,
    /**
     * Hug the node's own contents.
     */
    HUG
}
