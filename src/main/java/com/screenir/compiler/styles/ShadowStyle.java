package com.screenir.compiler.styles;

import com.screenir.compiler.util.Numbers;

import lombok.Value;

@Value
public class ShadowStyle {
    String color;
    double offsetX;
    double offsetY;
    double blur;
    double spread;

    /**
     * Geometry key {@code x,y,blur,spread}, used to match project shadow tokens.
     */
    public String geometryKey() {
        return Numbers.format(offsetX) + "," + Numbers.format(offsetY) + ","
                + Numbers.format(blur) + "," + Numbers.format(spread);
    }
}
