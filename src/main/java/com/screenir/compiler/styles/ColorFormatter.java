package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.RgbaColor;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Converts design-tool float colors into uppercase hex strings.
 */
@UtilityClass
public class ColorFormatter {

    /**
     * Effective alpha at or above this prints as an opaque 6-digit color.
     */
    static final double OPAQUE_ALPHA = 0.995;

    /**
     * {@code #RRGGBB}, or {@code #RRGGBBAA} when the color's alpha times the paint
     * opacity is below {@value #OPAQUE_ALPHA}.
     */
    public static String toHex(RgbaColor color, double opacity) {
        double alpha = color.getA() * opacity;
        String rgb = "#" + channel(color.getR()) + channel(color.getG()) + channel(color.getB());
        if (alpha >= OPAQUE_ALPHA) {
            return rgb;
        }
        return rgb + channel(alpha);
    }

    private static String channel(double value) {
        long scaled = Math.round(Math.max(0, Math.min(1, value)) * 255);
        return String.format(Locale.ROOT, "%02X", scaled);
    }
}
