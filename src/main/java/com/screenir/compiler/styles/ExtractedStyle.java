package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Padding;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Flattened visual style of one IR node, keyed by its style ref.
 * Absent properties are {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedStyle {

    @NonNull
    String id;

    String backgroundColor;
    GradientStyle backgroundGradient;

    String borderColor;
    Double borderWidth;

    /**
     * Uniform corner radius.
     */
    Double borderRadius;

    /**
     * Per-corner radii, set instead of {@link #borderRadius} when corners differ.
     */
    CornerRadius cornerRadii;

    ShadowStyle shadow;

    TypographyStyle typography;

    Double width;
    Double height;

    Position position;
    Double left;
    Double right;
    Double top;
    Double bottom;

    Double opacity;

    String flexDirection;
    String justifyContent;
    String alignItems;
    String alignSelf;
    Double gap;
    Padding padding;
    Double flex;
}
