package com.screenir.compiler.model.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Explicit flex-like layout declared on a frame by the design tool.
 */
@Value
@Builder(toBuilder = true)
public class AutoLayout {

    public enum Direction {
        HORIZONTAL,
        VERTICAL
    }

    public enum PrimaryAlign {
        MIN,
        CENTER,
        MAX,
        SPACE_BETWEEN,
        SPACE_AROUND
    }

    public enum CounterAlign {
        MIN,
        CENTER,
        MAX,
        BASELINE,
        STRETCH
    }

    @NonNull
    Direction direction;

    double gap;

    @NonNull
    @Builder.Default
    Padding padding = Padding.ZERO;

    @NonNull
    @Builder.Default
    PrimaryAlign primaryAlign = PrimaryAlign.MIN;

    @NonNull
    @Builder.Default
    CounterAlign counterAlign = CounterAlign.MIN;
}
