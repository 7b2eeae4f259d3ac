package com.screenir.compiler.layout;

import com.screenir.compiler.model.LayoutHints;
import com.screenir.compiler.model.VisualProperties;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.NodeType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A normalized node with its derived {@link LayoutMeta}.
 */
@Value
@Builder(toBuilder = true)
public class LayoutNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    NodeType type;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    @Builder.Default
    VisualProperties visuals = VisualProperties.NONE;

    @NonNull
    @Builder.Default
    LayoutHints layoutHints = LayoutHints.NONE;

    String text;

    String componentId;

    @NonNull
    LayoutMeta layout;

    @Singular
    List<LayoutNode> children;

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
