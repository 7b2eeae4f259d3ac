package com.screenir.compiler.model;

import com.screenir.compiler.model.raw.AutoLayout;
import com.screenir.compiler.model.raw.Constraints;
import com.screenir.compiler.model.raw.RawNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Layout-related declarations of a raw node: explicit auto-layout, sizing modes,
 * child alignment, positioning, scrolling and constraints.
 */
@Value
@Builder(toBuilder = true)
public class LayoutHints {

    public static final LayoutHints NONE = LayoutHints.builder().build();

    AutoLayout autoLayout;

    RawNode.SizingMode primaryAxisSizing;

    RawNode.SizingMode counterAxisSizing;

    RawNode.LayoutAlign layoutAlign;

    double layoutGrow;

    RawNode.Positioning positioning;

    @NonNull
    @Builder.Default
    RawNode.OverflowDirection overflowDirection = RawNode.OverflowDirection.NONE;

    Constraints constraints;

    public static LayoutHints of(RawNode node) {
        return LayoutHints.builder()
                .autoLayout(node.getAutoLayout())
                .primaryAxisSizing(node.getPrimaryAxisSizing())
                .counterAxisSizing(node.getCounterAxisSizing())
                .layoutAlign(node.getLayoutAlign())
                .layoutGrow(node.getLayoutGrow())
                .positioning(node.getPositioning())
                .overflowDirection(node.getOverflowDirection())
                .constraints(node.getConstraints())
                .build();
    }

    public boolean isAbsolutelyPositioned() {
        return positioning == RawNode.Positioning.ABSOLUTE;
    }

    public boolean isScrollable() {
        return overflowDirection != RawNode.OverflowDirection.NONE;
    }
}
