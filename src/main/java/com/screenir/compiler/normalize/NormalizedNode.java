package com.screenir.compiler.normalize;

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
 * A raw node that survived filtering, with useless wrapper groups collapsed.
 * Every node reachable from a normalized root was visible and not excluded by name.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    NodeType type;

    /**
     * {@code null} when the source node carried no geometry.
     */
    BoundingBox boundingBox;

    @NonNull
    @Builder.Default
    VisualProperties visuals = VisualProperties.NONE;

    @NonNull
    @Builder.Default
    LayoutHints layoutHints = LayoutHints.NONE;

    String text;

    String componentId;

    @Singular
    List<NormalizedNode> children;

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public int countNodes() {
        int count = 1;
        for (NormalizedNode child : children) {
            count += child.countNodes();
        }
        return count;
    }
}
