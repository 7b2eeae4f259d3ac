package com.screenir.compiler.recognize;

import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.model.VisualProperties;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.NodeType;

/**
 * Role tests evaluated by {@link SemanticClassifier}. Each test looks at one node in
 * isolation; ordering between them is the classifier's concern.
 */
public class NodePredicates {

    static final double BUTTON_MAX_HEIGHT = 80;
    static final double BUTTON_MIN_WIDTH = 40;
    static final double BUTTON_MIN_ASPECT = 1.5;
    static final double BUTTON_NARROW_WIDTH = 60;
    static final double CARD_MIN_SIZE = 60;

    private final ClassifierOptions options;

    public NodePredicates(ClassifierOptions options) {
        this.options = options;
    }

    public boolean isComponent(LayoutNode node) {
        return node.getType() == NodeType.INSTANCE;
    }

    public boolean isText(LayoutNode node) {
        return node.getType() == NodeType.TEXT && node.getText() != null && !node.getText().isEmpty();
    }

    /**
     * Any image fill, or vector artwork.
     */
    public boolean isImage(LayoutNode node) {
        return node.getVisuals().hasImageFill() || node.getType().isVectorPrimitive();
    }

    /**
     * Small, roughly square artwork: a vector, a small image, or a frame/group made
     * only of vectors.
     */
    public boolean isIcon(LayoutNode node) {
        boolean vector = node.getType().isVectorPrimitive();
        if (!vector && !node.getType().isFrameOrGroup() && !isImage(node)) {
            return false;
        }

        BoundingBox box = node.getBoundingBox();
        double width = box.getWidth();
        double height = box.getHeight();
        if (width > options.getIconMaxSize() || height > options.getIconMaxSize()) {
            return false;
        }
        if (width < options.getIconMinSize() || height < options.getIconMinSize()) {
            return false;
        }
        double aspect = box.aspectRatio();
        if (aspect < 0.5 || aspect > 2) {
            return false;
        }

        if (isImage(node)) {
            return true;
        }
        return node.getType().isFrameOrGroup()
                && node.hasChildren()
                && node.getChildren().stream().allMatch(child -> child.getType().isVectorPrimitive());
    }

    /**
     * Solid background with a text child, at most 80px tall and 40px wide, and
     * wider than tall unless it is a narrow near-square icon button.
     */
    public boolean isButton(LayoutNode node) {
        if (!node.hasChildren() || !node.getVisuals().hasSolidFill()) {
            return false;
        }
        if (node.getChildren().stream().noneMatch(this::isText)) {
            return false;
        }

        BoundingBox box = node.getBoundingBox();
        if (box.getHeight() > BUTTON_MAX_HEIGHT || box.getWidth() < BUTTON_MIN_WIDTH) {
            return false;
        }
        double aspect = box.aspectRatio();
        if (aspect < BUTTON_MIN_ASPECT && box.getWidth() < BUTTON_NARROW_WIDTH) {
            return aspect >= 0.8 && aspect <= 1.2;
        }
        return true;
    }

    /**
     * At least 60px on both axes with two of: corner radius, drop shadow, background.
     */
    public boolean isCard(LayoutNode node) {
        if (!node.hasChildren()) {
            return false;
        }
        VisualProperties visuals = node.getVisuals();
        int treatments = 0;
        if (visuals.hasCornerRadius()) {
            treatments++;
        }
        if (visuals.hasDropShadow()) {
            treatments++;
        }
        if (!visuals.getFills().isEmpty()) {
            treatments++;
        }
        if (treatments < 2) {
            return false;
        }
        BoundingBox box = node.getBoundingBox();
        return box.getWidth() >= CARD_MIN_SIZE && box.getHeight() >= CARD_MIN_SIZE;
    }

    public boolean hasVisibleSolidFill(LayoutNode node) {
        return node.getVisuals().getFills().stream().anyMatch(f -> f.isSolid() && f.getOpacity() > 0.1);
    }

    public boolean hasGhostFill(LayoutNode node) {
        return node.getVisuals().getFills().stream().anyMatch(f -> f.isSolid() && f.getOpacity() < 0.2);
    }
}
