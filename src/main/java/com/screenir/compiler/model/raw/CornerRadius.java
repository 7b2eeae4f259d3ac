package com.screenir.compiler.model.raw;

import lombok.Value;

/**
 * Corner radius, either uniform or per corner.
 */
@Value
public class CornerRadius {
    double topLeft;
    double topRight;
    double bottomRight;
    double bottomLeft;

    public static CornerRadius uniform(double radius) {
        return new CornerRadius(radius, radius, radius, radius);
    }

    public boolean isUniform() {
        return topLeft == topRight && topLeft == bottomRight && topLeft == bottomLeft;
    }

    public boolean isZero() {
        return topLeft == 0 && topRight == 0 && bottomRight == 0 && bottomLeft == 0;
    }
}
