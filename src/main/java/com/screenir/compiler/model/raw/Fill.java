package com.screenir.compiler.model.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single paint layer of a node: solid color, gradient or image.
 */
@Value
@Builder(toBuilder = true)
public class Fill {

    public enum Type {
        SOLID,
        GRADIENT,
        IMAGE
    }

    public enum GradientType {
        LINEAR,
        RADIAL
    }

    @NonNull
    Type type;

    /**
     * Solid fills only.
     */
    RgbaColor color;

    @Builder.Default
    double opacity = 1.0;

    GradientType gradientType;

    @Singular
    List<GradientStop> gradientStops;

    /**
     * Image fills only: reference to the image asset.
     */
    String imageRef;

    public static Fill solid(RgbaColor color) {
        return solid(color, 1.0);
    }

    public static Fill solid(RgbaColor color, double opacity) {
        return Fill.builder().type(Type.SOLID).color(color).opacity(opacity).build();
    }

    public static Fill image(String imageRef) {
        return Fill.builder().type(Type.IMAGE).imageRef(imageRef).build();
    }

    public boolean isSolid() {
        return type == Type.SOLID;
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }

    public boolean isGradient() {
        return type == Type.GRADIENT;
    }
}
