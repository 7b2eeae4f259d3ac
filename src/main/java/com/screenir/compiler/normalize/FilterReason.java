package com.screenir.compiler.normalize;

/**
 * Why a node was excluded from the normalized tree.
 */
public enum FilterReason {
    HIDDEN,
    PATTERN_MATCH,
    STATUS_BAR,
    HOME_INDICATOR,
    OS_COMPONENT
}
