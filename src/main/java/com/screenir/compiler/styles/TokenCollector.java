package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Padding;
import com.screenir.compiler.util.Numbers;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the document's design-token vocabulary from its extracted styles.
 * Values are de-duplicated by content and keyed by a name derived from the value.
 */
public class TokenCollector {

    public DesignTokens collect(Collection<ExtractedStyle> styles) {
        Map<String, String> colors = new LinkedHashMap<>();
        TreeSet<Double> spacing = new TreeSet<>();
        TreeSet<Double> radii = new TreeSet<>();
        Map<String, TypographyToken> typography = new LinkedHashMap<>();
        Map<String, ShadowStyle> shadows = new LinkedHashMap<>();

        for (ExtractedStyle style : styles) {
            addColor(colors, style.getBackgroundColor());
            addColor(colors, style.getBorderColor());
            if (style.getShadow() != null) {
                addColor(colors, style.getShadow().getColor());
                shadows.putIfAbsent(shadowKey(style.getShadow()), style.getShadow());
            }
            if (style.getTypography() != null) {
                addColor(colors, style.getTypography().getColor());
                TypographyToken token = TypographyToken.of(style.getTypography());
                typography.putIfAbsent(typographyKey(token), token);
            }

            addPositive(spacing, style.getGap());
            Padding padding = style.getPadding();
            if (padding != null) {
                addPositive(spacing, padding.getTop());
                addPositive(spacing, padding.getRight());
                addPositive(spacing, padding.getBottom());
                addPositive(spacing, padding.getLeft());
            }

            addPositive(radii, style.getBorderRadius());
            CornerRadius corners = style.getCornerRadii();
            if (corners != null) {
                addPositive(radii, corners.getTopLeft());
                addPositive(radii, corners.getTopRight());
                addPositive(radii, corners.getBottomRight());
                addPositive(radii, corners.getBottomLeft());
            }
        }

        return new DesignTokens(
                Collections.unmodifiableMap(colors),
                numericTokens("spacing_", spacing),
                numericTokens("radius_", radii),
                Collections.unmodifiableMap(typography),
                Collections.unmodifiableMap(shadows));
    }

    public static String colorKey(String hex) {
        return "color_" + hex.replace("#", "");
    }

    public static String typographyKey(TypographyToken token) {
        return "text_" + token.getFontFamily().replaceAll("[^A-Za-z0-9]", "")
                + "_" + Numbers.format(token.getFontSize())
                + "_" + Numbers.format(token.getFontWeight())
                + "_" + Numbers.format(token.getLineHeight());
    }

    public static String shadowKey(ShadowStyle shadow) {
        return "shadow_" + shadow.geometryKey().replace(',', '_');
    }

    private static void addColor(Map<String, String> colors, String hex) {
        if (hex != null) {
            colors.putIfAbsent(colorKey(hex), hex);
        }
    }

    private static void addPositive(TreeSet<Double> values, Double value) {
        if (value != null && value > 0) {
            values.add(value);
        }
    }

    private static Map<String, Double> numericTokens(String prefix, TreeSet<Double> values) {
        Map<String, Double> tokens = new LinkedHashMap<>();
        for (Double value : values) {
            tokens.put(prefix + Numbers.format(value), value);
        }
        return Collections.unmodifiableMap(tokens);
    }
}
