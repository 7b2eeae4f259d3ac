package com.screenir.compiler.styles;

import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutType;
import com.screenir.compiler.model.VisualProperties;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything style extraction needs to know about one layout node.
 */
@Value
@Builder
public class NodeVisualProps {

    @NonNull
    VisualProperties visuals;

    double width;

    double height;

    LayoutMeta layout;

    /**
     * Layout type of the parent; {@code null} for the root.
     */
    LayoutType parentLayoutType;

    /**
     * Set when the node is absolutely positioned inside its parent.
     */
    AbsoluteOffsets absoluteOffsets;
}
