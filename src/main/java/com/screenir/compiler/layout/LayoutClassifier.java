package com.screenir.compiler.layout;

import com.screenir.compiler.model.LayoutHints;
import com.screenir.compiler.model.raw.AutoLayout;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.Padding;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.normalize.NormalizedNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pipeline stage: attaches a {@link LayoutMeta} to every node.
 * An explicit auto-layout declaration is trusted; otherwise the layout is inferred
 * from child geometry.
 */
public class LayoutClassifier {

    private static final Logger log = LoggerFactory.getLogger(LayoutClassifier.class);

    static final double ALIGN_THRESHOLD = 10;
    static final double END_ALIGN_MIN_START = 20;

    private final LayoutDetector detector;

    public LayoutClassifier() {
        this(new LayoutDetector());
    }

    public LayoutClassifier(LayoutDetector detector) {
        this.detector = detector;
    }

    public LayoutNode addLayout(NormalizedNode root) {
        LayoutNode result = addLayout(root, null);
        log.debug("Layout '{}': {}", root.getName(), result.getLayout().getType());
        return result;
    }

    private LayoutNode addLayout(NormalizedNode node, LayoutType parentType) {
        LayoutMeta layout = extractLayoutMeta(node, parentType);

        LayoutNode.LayoutNodeBuilder builder = LayoutNode.builder()
                .id(node.getId())
                .name(node.getName())
                .type(node.getType())
                .boundingBox(boxOf(node))
                .visuals(node.getVisuals())
                .layoutHints(node.getLayoutHints())
                .text(node.getText())
                .componentId(node.getComponentId())
                .layout(layout);

        for (NormalizedNode child : node.getChildren()) {
            builder.child(addLayout(child, layout.getType()));
        }
        return builder.build();
    }

    LayoutMeta extractLayoutMeta(NormalizedNode node, LayoutType parentType) {
        LayoutHints hints = node.getLayoutHints();
        AutoLayout autoLayout = hints.getAutoLayout();
        Overflow overflow = hints.isScrollable() ? Overflow.SCROLL : Overflow.VISIBLE;

        if (autoLayout != null) {
            LayoutType type = autoLayout.getDirection() == AutoLayout.Direction.HORIZONTAL
                    ? LayoutType.ROW
                    : LayoutType.COLUMN;
            return withSizing(LayoutMeta.builder()
                    .type(type)
                    .gap(autoLayout.getGap())
                    .padding(autoLayout.getPadding())
                    .mainAlign(mainAlignOf(autoLayout.getPrimaryAlign()))
                    .crossAlign(crossAlignOf(autoLayout.getCounterAlign()))
                    .overflow(overflow), node, type, parentType);
        }

        BoundingBox container = boxOf(node);
        List<BoundingBox> children = childBoxes(node);
        LayoutType type = detector.detect(children);

        LayoutMeta.LayoutMetaBuilder builder = LayoutMeta.builder()
                .type(type)
                .gap(detector.gap(children, type))
                .padding(inferPadding(container, children))
                .overflow(overflow);
        if (type.isFlow()) {
            builder.mainAlign(inferMainAlign(container, children, type))
                    .crossAlign(inferCrossAlign(container, children, type));
        }
        return withSizing(builder, node, type, parentType);
    }

    private LayoutMeta withSizing(LayoutMeta.LayoutMetaBuilder builder, NormalizedNode node, LayoutType ownType,
                                  LayoutType parentType) {
        LayoutHints hints = node.getLayoutHints();
        Sizing horizontal = Sizing.FIXED;
        Sizing vertical = Sizing.FIXED;

        if (hints.getLayoutGrow() == 1) {
            if (parentType == LayoutType.ROW) {
                horizontal = Sizing.FILL;
            } else if (parentType == LayoutType.COLUMN) {
                vertical = Sizing.FILL;
            }
        }
        if (hints.getLayoutAlign() == RawNode.LayoutAlign.STRETCH) {
            if (parentType == LayoutType.ROW) {
                vertical = Sizing.FILL;
            } else if (parentType == LayoutType.COLUMN) {
                horizontal = Sizing.FILL;
            }
        }

        boolean horizontalMain = ownType == LayoutType.ROW;
        if (hints.getPrimaryAxisSizing() == RawNode.SizingMode.AUTO) {
            if (horizontalMain) {
                horizontal = Sizing.HUG;
            } else {
                vertical = Sizing.HUG;
            }
        }
        if (hints.getCounterAxisSizing() == RawNode.SizingMode.AUTO) {
            if (horizontalMain) {
                vertical = Sizing.HUG;
            } else {
                horizontal = Sizing.HUG;
            }
        }
        return builder.horizontalSizing(horizontal).verticalSizing(vertical).build();
    }

    Padding inferPadding(BoundingBox container, List<BoundingBox> children) {
        if (children.isEmpty()) {
            return Padding.ZERO;
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (BoundingBox box : children) {
            minX = Math.min(minX, box.getX());
            minY = Math.min(minY, box.getY());
            maxX = Math.max(maxX, box.getRight());
            maxY = Math.max(maxY, box.getBottom());
        }
        return new Padding(
                Math.max(0, Math.round(minY - container.getY())),
                Math.max(0, Math.round(container.getRight() - maxX)),
                Math.max(0, Math.round(container.getBottom() - maxY)),
                Math.max(0, Math.round(minX - container.getX())));
    }

    MainAlign inferMainAlign(BoundingBox container, List<BoundingBox> children, LayoutType type) {
        boolean row = type == LayoutType.ROW;
        double first = Double.POSITIVE_INFINITY;
        double last = Double.NEGATIVE_INFINITY;
        for (BoundingBox box : children) {
            first = Math.min(first, row ? box.getX() : box.getY());
            last = Math.max(last, row ? box.getRight() : box.getBottom());
        }
        double contentStart = first - (row ? container.getX() : container.getY());
        double contentEnd = (row ? container.getRight() : container.getBottom()) - last;

        if (Math.abs(contentStart - contentEnd) < ALIGN_THRESHOLD) {
            return MainAlign.CENTER;
        }
        if (contentEnd < ALIGN_THRESHOLD && contentStart > END_ALIGN_MIN_START) {
            return MainAlign.END;
        }
        return MainAlign.START;
    }

    CrossAlign inferCrossAlign(BoundingBox container, List<BoundingBox> children, LayoutType type) {
        boolean row = type == LayoutType.ROW;
        double leading = 0;
        double trailing = 0;
        for (BoundingBox box : children) {
            leading += row ? box.getY() - container.getY() : box.getX() - container.getX();
            trailing += row ? container.getBottom() - box.getBottom() : container.getRight() - box.getRight();
        }
        leading /= children.size();
        trailing /= children.size();

        if (Math.abs(leading - trailing) < ALIGN_THRESHOLD) {
            return CrossAlign.CENTER;
        }
        return trailing < leading ? CrossAlign.END : CrossAlign.START;
    }

    private static MainAlign mainAlignOf(AutoLayout.PrimaryAlign align) {
        return switch (align) {
            case MIN -> MainAlign.START;
            case CENTER -> MainAlign.CENTER;
            case MAX -> MainAlign.END;
            case SPACE_BETWEEN -> MainAlign.SPACE_BETWEEN;
            case SPACE_AROUND -> MainAlign.SPACE_AROUND;
        };
    }

    private static CrossAlign crossAlignOf(AutoLayout.CounterAlign align) {
        return switch (align) {
            case MIN -> CrossAlign.START;
            case CENTER -> CrossAlign.CENTER;
            case MAX -> CrossAlign.END;
            case BASELINE -> CrossAlign.BASELINE;
            case STRETCH -> CrossAlign.STRETCH;
        };
    }

    private static List<BoundingBox> childBoxes(NormalizedNode node) {
        List<BoundingBox> boxes = new ArrayList<>(node.getChildren().size());
        for (NormalizedNode child : node.getChildren()) {
            boxes.add(boxOf(child));
        }
        return boxes;
    }

    private static BoundingBox boxOf(NormalizedNode node) {
        return node.getBoundingBox() != null ? node.getBoundingBox() : BoundingBox.ZERO;
    }
}
