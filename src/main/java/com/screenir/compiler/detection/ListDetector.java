package com.screenir.compiler.detection;

import com.screenir.compiler.ir.CardIr;
import com.screenir.compiler.ir.ContainerIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutType;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.util.NamingUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds containers whose children are interchangeable list items.
 *
 * <p>A container qualifies when it is scrollable (any number of children) or has at
 * least three children, and every child has the same shallow structure as the first
 * and a width and height within 10% of it. Items of a detected list are not searched
 * for nested lists.
 */
public class ListDetector {

    private static final Logger log = LoggerFactory.getLogger(ListDetector.class);

    static final int MIN_LIST_ITEMS = 3;
    static final double SIZE_TOLERANCE = 0.1;

    private static final double MIN_DIMENSION = 0.01;
    private static final double EPSILON = 1e-9;
    private static final int MIN_NAME_LENGTH = 3;

    public List<ListHint> detectLists(IrNode root) {
        List<ListHint> hints = new ArrayList<>();
        detectRecursive(root, hints);
        log.debug("Detected {} list(s)", hints.size());
        return hints;
    }

    private void detectRecursive(IrNode node, List<ListHint> hints) {
        Optional<ListHint> hint = detectInContainer(node);
        if (hint.isPresent()) {
            hints.add(hint.get());
            return;
        }
        for (IrNode child : node.getChildren()) {
            if (child instanceof ContainerIr || child instanceof CardIr) {
                detectRecursive(child, hints);
            }
        }
    }

    Optional<ListHint> detectInContainer(IrNode node) {
        LayoutMeta layout = layoutOf(node);
        if (layout == null) {
            return Optional.empty();
        }
        List<IrNode> children = node.getChildren();
        if (children.isEmpty()) {
            return Optional.empty();
        }
        if (!layout.isScrollable() && children.size() < MIN_LIST_ITEMS) {
            return Optional.empty();
        }

        IrNode template = children.get(0);
        for (IrNode child : children) {
            if (!StructuralSignature.sameShallowStructure(child, template)
                    || !hasSimilarSize(child.getBoundingBox(), template.getBoundingBox())) {
                return Optional.empty();
            }
        }

        ListHint.ListHintBuilder builder = ListHint.builder()
                .containerId(node.getId())
                .orientation(orientation(layout, children))
                .itemType(inferItemType(template));
        children.forEach(child -> builder.itemId(child.getId()));
        return Optional.of(builder.build());
    }

    static boolean hasSimilarSize(BoundingBox a, BoundingBox b) {
        return withinTolerance(a.getWidth(), b.getWidth()) && withinTolerance(a.getHeight(), b.getHeight());
    }

    private static boolean withinTolerance(double value, double reference) {
        double floor = Math.max(reference, MIN_DIMENSION);
        return Math.abs(value - reference) / floor <= SIZE_TOLERANCE + EPSILON;
    }

    static String inferItemType(IrNode template) {
        String name = template.getName();
        if (!NamingUtil.isGenericName(name)) {
            String pascal = NamingUtil.toPascalCase(name).replaceFirst("^\\d+", "");
            if (pascal.length() >= MIN_NAME_LENGTH) {
                return pascal + "Item";
            }
        }
        String hash = NamingUtil.shortHash(template.getId());
        return switch (template.getSemanticType()) {
            case CARD -> "CardItem" + hash;
            case CONTAINER -> "ListItem" + hash;
            case BUTTON -> "ButtonItem" + hash;
            default -> "Item" + hash;
        };
    }

    private static Orientation orientation(LayoutMeta layout, List<IrNode> children) {
        if (layout.getType() == LayoutType.ROW) {
            return Orientation.HORIZONTAL;
        }
        if (layout.getType() == LayoutType.COLUMN || children.size() < 2) {
            return Orientation.VERTICAL;
        }
        // no flow axis: follow the larger spread of item origins
        double minX = Double.MAX_VALUE, maxX = -Double.MAX_VALUE;
        double minY = Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (IrNode child : children) {
            BoundingBox box = child.getBoundingBox();
            minX = Math.min(minX, box.getX());
            maxX = Math.max(maxX, box.getX());
            minY = Math.min(minY, box.getY());
            maxY = Math.max(maxY, box.getY());
        }
        return (maxX - minX) > (maxY - minY) ? Orientation.HORIZONTAL : Orientation.VERTICAL;
    }

    private static LayoutMeta layoutOf(IrNode node) {
        if (node instanceof ContainerIr container) {
            return container.getLayout();
        }
        if (node instanceof CardIr card) {
            return card.getLayout();
        }
        return null;
    }
}
