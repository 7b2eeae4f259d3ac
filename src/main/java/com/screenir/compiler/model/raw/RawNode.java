package com.screenir.compiler.model.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A node of the design document as delivered by the design tool.
 * Optional properties are {@code null} when the source omits them.
 */
@Value
@Builder(toBuilder = true)
public class RawNode {

    public enum LayoutAlign {
        INHERIT,
        STRETCH,
        MIN,
        CENTER,
        MAX
    }

    public enum Positioning {
        AUTO,
        ABSOLUTE
    }

    public enum OverflowDirection {
        NONE,
        HORIZONTAL_SCROLLING,
        VERTICAL_SCROLLING,
        BOTH_SCROLLING
    }

    public enum SizingMode {
        FIXED,
        AUTO
    }

    String id;

    @NonNull
    @Builder.Default
    String name = "";

    @NonNull
    @Builder.Default
    NodeType type = NodeType.FRAME;

    BoundingBox boundingBox;

    @Builder.Default
    boolean visible = true;

    @Builder.Default
    double opacity = 1.0;

    @Singular
    List<Fill> fills;

    @Singular
    List<Stroke> strokes;

    @Singular
    List<Effect> effects;

    CornerRadius cornerRadius;

    /**
     * Text content, for {@link NodeType#TEXT} nodes.
     */
    String characters;

    TypographyInfo typography;

    AutoLayout autoLayout;

    SizingMode primaryAxisSizing;

    SizingMode counterAxisSizing;

    LayoutAlign layoutAlign;

    double layoutGrow;

    Positioning positioning;

    @NonNull
    @Builder.Default
    OverflowDirection overflowDirection = OverflowDirection.NONE;

    Constraints constraints;

    /**
     * Main component id, for {@link NodeType#INSTANCE} nodes.
     */
    String componentId;

    @Singular
    List<RawNode> children;
}
