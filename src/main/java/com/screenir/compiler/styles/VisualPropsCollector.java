package com.screenir.compiler.styles;

import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.layout.LayoutType;
import com.screenir.compiler.model.LayoutHints;
import com.screenir.compiler.model.raw.BoundingBox;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indexes the visual properties of a layout tree by node id.
 */
public class VisualPropsCollector {

    private final ConstraintMapper constraintMapper;

    public VisualPropsCollector() {
        this(new ConstraintMapper());
    }

    public VisualPropsCollector(ConstraintMapper constraintMapper) {
        this.constraintMapper = constraintMapper;
    }

    public Map<String, NodeVisualProps> collect(LayoutNode root) {
        Map<String, NodeVisualProps> map = new LinkedHashMap<>();
        walk(root, null, null, map);
        return map;
    }

    private void walk(LayoutNode node, BoundingBox parentBounds, LayoutType parentType,
                      Map<String, NodeVisualProps> map) {
        LayoutHints hints = node.getLayoutHints();
        boolean insideFlow = parentType != null && parentType.isFlow();

        AbsoluteOffsets offsets = null;
        if (parentBounds != null && (hints.isAbsolutelyPositioned() || !insideFlow)) {
            offsets = constraintMapper.map(node.getBoundingBox(), hints.getConstraints(), parentBounds);
        }

        map.putIfAbsent(node.getId(), NodeVisualProps.builder()
                .visuals(node.getVisuals())
                .width(node.getBoundingBox().getWidth())
                .height(node.getBoundingBox().getHeight())
                .layout(node.getLayout())
                .parentLayoutType(parentType)
                .absoluteOffsets(offsets)
                .build());

        for (LayoutNode child : node.getChildren()) {
            walk(child, node.getBoundingBox(), node.getLayout().getType(), map);
        }
    }
}
