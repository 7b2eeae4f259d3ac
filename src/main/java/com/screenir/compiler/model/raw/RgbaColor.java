package com.screenir.compiler.model.raw;

import lombok.Value;

/**
 * Color as delivered by the design tool: each channel a float in [0, 1].
 */
@Value
public class RgbaColor {

    public static final RgbaColor BLACK = new RgbaColor(0, 0, 0, 1);
    public static final RgbaColor WHITE = new RgbaColor(1, 1, 1, 1);

    double r;
    double g;
    double b;
    double a;

    public static RgbaColor opaque(double r, double g, double b) {
        return new RgbaColor(r, g, b, 1);
    }

    /**
     * Builds a color from 0-255 channel values.
     */
    public static RgbaColor fromRgb255(int r, int g, int b) {
        return new RgbaColor(r / 255.0, g / 255.0, b / 255.0, 1);
    }
}
