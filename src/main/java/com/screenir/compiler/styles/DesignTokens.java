package com.screenir.compiler.styles;

import lombok.Value;

import java.util.Map;

/**
 * De-duplicated design values found in one document, keyed by content-derived names
 * such as {@code color_3B82F6} or {@code spacing_16}.
 */
@Value
public class DesignTokens {
    Map<String, String> colors;
    Map<String, Double> spacing;
    Map<String, Double> radii;
    Map<String, TypographyToken> typography;
    Map<String, ShadowStyle> shadows;

    public static DesignTokens empty() {
        return new DesignTokens(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return colors.isEmpty() && spacing.isEmpty() && radii.isEmpty() && typography.isEmpty() && shadows.isEmpty();
    }
}
