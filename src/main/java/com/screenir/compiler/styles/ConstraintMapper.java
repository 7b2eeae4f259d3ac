package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.Constraints;

/**
 * Chooses edge offsets for an absolutely positioned node from its resize constraints.
 * Nodes without constraints are pinned to the parent's top-left corner.
 */
public class ConstraintMapper {

    public AbsoluteOffsets map(BoundingBox box, Constraints constraints, BoundingBox parent) {
        Constraints.Horizontal horizontal = constraints != null && constraints.getHorizontal() != null
                ? constraints.getHorizontal()
                : Constraints.Horizontal.LEFT;
        Constraints.Vertical vertical = constraints != null && constraints.getVertical() != null
                ? constraints.getVertical()
                : Constraints.Vertical.TOP;

        double relativeX = box.getX() - parent.getX();
        double relativeY = box.getY() - parent.getY();
        double rightInset = parent.getWidth() - (relativeX + box.getWidth());
        double bottomInset = parent.getHeight() - (relativeY + box.getHeight());

        AbsoluteOffsets.AbsoluteOffsetsBuilder builder = AbsoluteOffsets.builder();
        switch (horizontal) {
            case RIGHT -> builder.right(rightInset);
            case LEFT_RIGHT -> builder.left(relativeX).right(rightInset).stretchWidth(true);
            default -> builder.left(relativeX);
        }
        switch (vertical) {
            case BOTTOM -> builder.bottom(bottomInset);
            case TOP_BOTTOM -> builder.top(relativeY).bottom(bottomInset).stretchHeight(true);
            default -> builder.top(relativeY);
        }
        return builder.build();
    }
}
