package com.screenir.compiler.normalize;

import com.screenir.compiler.model.raw.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes layout-neutral GROUP wrappers. Frames are never unwrapped since they
 * usually carry layout intent.
 */
public class GroupUnwrapper {

    /**
     * A GROUP with exactly one child and no visual treatment of its own.
     */
    public boolean isUselessGroup(NormalizedNode node) {
        return node.getType() == NodeType.GROUP
                && node.getChildren().size() == 1
                && !node.getVisuals().hasVisualTreatment();
    }

    /**
     * A GROUP with at least one child and no visual treatment of its own.
     */
    public boolean isWrapperGroup(NormalizedNode node) {
        return node.getType() == NodeType.GROUP
                && node.hasChildren()
                && !node.getVisuals().hasVisualTreatment();
    }

    /**
     * Children are processed before the parent is tested, so a chain of nested
     * wrappers collapses in a single pass.
     */
    public NormalizedNode unwrapUselessGroups(NormalizedNode node) {
        List<NormalizedNode> processed = new ArrayList<>(node.getChildren().size());
        for (NormalizedNode child : node.getChildren()) {
            processed.add(unwrapUselessGroups(child));
        }
        NormalizedNode result = node.toBuilder().clearChildren().children(processed).build();

        if (!isUselessGroup(result)) {
            return result;
        }
        NormalizedNode child = result.getChildren().get(0);
        if (child.getBoundingBox() != null) {
            return child;
        }
        return child.toBuilder().boundingBox(result.getBoundingBox()).build();
    }

    /**
     * Replaces every wrapper group in the list by its (recursively flattened) children.
     */
    public List<NormalizedNode> flattenWrapperGroups(List<NormalizedNode> nodes) {
        List<NormalizedNode> result = new ArrayList<>();
        for (NormalizedNode node : nodes) {
            NormalizedNode processed = node.toBuilder()
                    .clearChildren()
                    .children(flattenWrapperGroups(node.getChildren()))
                    .build();
            if (isWrapperGroup(processed)) {
                result.addAll(processed.getChildren());
            } else {
                result.add(processed);
            }
        }
        return result;
    }
}
