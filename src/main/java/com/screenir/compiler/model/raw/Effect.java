package com.screenir.compiler.model.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Visual effect: drop/inner shadow or blur.
 */
@Value
@Builder(toBuilder = true)
public class Effect {

    public enum Type {
        DROP_SHADOW,
        INNER_SHADOW,
        LAYER_BLUR,
        BACKGROUND_BLUR
    }

    @NonNull
    Type type;

    /**
     * Shadows only.
     */
    RgbaColor color;

    double offsetX;
    double offsetY;
    double radius;
    double spread;

    public static Effect dropShadow(RgbaColor color, double offsetX, double offsetY, double radius, double spread) {
        return Effect.builder()
                .type(Type.DROP_SHADOW)
                .color(color)
                .offsetX(offsetX)
                .offsetY(offsetY)
                .radius(radius)
                .spread(spread)
                .build();
    }

    public boolean isDropShadow() {
        return type == Type.DROP_SHADOW;
    }
}
