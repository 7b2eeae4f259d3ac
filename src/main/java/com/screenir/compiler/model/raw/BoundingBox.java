package com.screenir.compiler.model.raw;

import lombok.Value;

/**
 * Absolute bounding box of a node in document coordinates.
 */
@Value
public class BoundingBox {

    public static final BoundingBox ZERO = new BoundingBox(0, 0, 0, 0);

    double x;
    double y;
    double width;
    double height;

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public double getArea() {
        return width * height;
    }

    /**
     * Width divided by height; 0 when the box has no height.
     */
    public double aspectRatio() {
        return height == 0 ? 0 : width / height;
    }
}
