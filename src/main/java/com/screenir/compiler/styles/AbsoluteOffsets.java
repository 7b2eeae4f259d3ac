package com.screenir.compiler.styles;

import lombok.Builder;
import lombok.Value;

/**
 * Edge offsets of an absolutely positioned node relative to its parent.
 * {@code stretchWidth}/{@code stretchHeight} mean the size follows the offsets.
 */
@Value
@Builder
public class AbsoluteOffsets {
    Double left;
    Double right;
    Double top;
    Double bottom;
    boolean stretchWidth;
    boolean stretchHeight;
}
