package com.screenir.compiler.mapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Token table of the target project: value to token path per category.
 * Typography keys are {@link TypographyKey} strings, shadow keys are
 * {@code x,y,blur,spread}.
 */
@Value
@Builder(toBuilder = true)
public class ProjectTokens {

    @Singular
    Map<String, String> colors;

    @Singular("spacingToken")
    Map<Double, String> spacing;

    @Singular("radius")
    Map<Double, String> radii;

    @Singular("typographyToken")
    Map<String, String> typography;

    @Singular
    Map<String, String> shadows;

    public static ProjectTokens empty() {
        return ProjectTokens.builder().build();
    }

    public boolean isEmpty() {
        return colors.isEmpty() && spacing.isEmpty() && radii.isEmpty() && typography.isEmpty() && shadows.isEmpty();
    }

    public int size() {
        return colors.size() + spacing.size() + radii.size() + typography.size() + shadows.size();
    }
}
