package com.screenir.compiler.layout;

import com.screenir.compiler.model.raw.Padding;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Flex-like layout model derived for one node.
 */
@Value
@Builder(toBuilder = true)
public class LayoutMeta {

    @NonNull
    LayoutType type;

    double gap;

    @NonNull
    @Builder.Default
    Padding padding = Padding.ZERO;

    @NonNull
    @Builder.Default
    MainAlign mainAlign = MainAlign.START;

    @NonNull
    @Builder.Default
    CrossAlign crossAlign = CrossAlign.START;

    @NonNull
    @Builder.Default
    Sizing horizontalSizing = Sizing.FIXED;

    @NonNull
    @Builder.Default
    Sizing verticalSizing = Sizing.FIXED;

    @NonNull
    @Builder.Default
    Overflow overflow = Overflow.VISIBLE;

    /**
     * Column layout with no gap, padding or scrolling; used for the empty screen.
     */
    public static LayoutMeta emptyColumn() {
        return LayoutMeta.builder().type(LayoutType.COLUMN).build();
    }

    public boolean isScrollable() {
        return overflow == Overflow.SCROLL;
    }
}
