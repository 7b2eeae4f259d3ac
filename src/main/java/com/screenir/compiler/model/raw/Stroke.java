package com.screenir.compiler.model.raw;

import lombok.Value;

@Value
public class Stroke {
    RgbaColor color;
    double weight;
    double opacity;

    public static Stroke of(RgbaColor color, double weight) {
        return new Stroke(color, weight, 1.0);
    }
}
