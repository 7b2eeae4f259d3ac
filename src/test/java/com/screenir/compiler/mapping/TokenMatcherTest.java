package com.screenir.compiler.mapping;

import com.screenir.compiler.styles.DesignTokens;
import com.screenir.compiler.styles.ShadowStyle;
import com.screenir.compiler.styles.TypographyToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TokenMatcher, NumericMatcher and TypographyKey.
 */
class TokenMatcherTest {

    private final TokenMatcher matcher = new TokenMatcher();
    private final NumericMatcher numericMatcher = new NumericMatcher();

    private final ProjectTokens project = ProjectTokens.builder()
            .color("#3B82F6", "colors.primary")
            .color("#FFFFFF", "colors.background")
            .spacingToken(4.0, "spacing.xs")
            .spacingToken(8.0, "spacing.sm")
            .spacingToken(16.0, "spacing.md")
            .spacingToken(24.0, "spacing.lg")
            .radius(8.0, "radii.md")
            .radius(16.0, "radii.lg")
            .radius(9999.0, "radii.full")
            .typographyToken("Inter:16:400:24", "typography.body")
            .typographyToken("Inter:24:700:32", "typography.heading")
            .shadow("0,2,8,0", "shadows.card")
            .build();

    @Test
    void testMapsEveryCategoryBySourceValue() {
        DesignTokens tokens = new DesignTokens(
                Map.of("color_3B82F6", "#3B82F6", "color_EF4444", "#EF4444"),
                Map.of("spacing_15", 15.0, "spacing_40", 40.0),
                Map.of("radius_8", 8.0),
                Map.of("text_Inter_16_400_24", new TypographyToken("Inter", 16, 400, 24)),
                Map.of("shadow_0_2_8_0", new ShadowStyle("#00000040", 0, 2, 8, 0),
                        "shadow_0_4_12_0", new ShadowStyle("#00000040", 0, 4, 12, 0)));

        TokenMappings mappings = matcher.matchTokens(tokens, project);

        assertThat(mappings.getColors())
                .containsEntry("#3B82F6", "colors.primary")
                .containsEntry("#EF4444", "#EF4444");
        assertThat(mappings.getSpacing())
                .containsEntry("15", "spacing.md")
                .containsEntry("40", "40");
        assertThat(mappings.getRadii()).containsEntry("8", "radii.md");
        assertThat(mappings.getTypography()).containsEntry("Inter:16:400:24", "typography.body");
        assertThat(mappings.getShadows())
                .containsEntry("0,2,8,0", "shadows.card")
                .containsEntry("0,4,12,0", "0,4,12,0");
        assertThat(mappings.totalCount()).isEqualTo(8);
        assertThat(mappings.matchedCount()).isEqualTo(5);
    }

    @Test
    void testNullProjectLeavesEverythingUnmatched() {
        DesignTokens tokens = new DesignTokens(Map.of("color_3B82F6", "#3B82F6"), Map.of("spacing_16", 16.0),
                Map.of(), Map.of(), Map.of());

        TokenMappings mappings = matcher.matchTokens(tokens, null);

        assertThat(mappings.getColors()).containsEntry("#3B82F6", "#3B82F6");
        assertThat(mappings.getSpacing()).containsEntry("16", "16");
        assertThat(mappings.matchedCount()).isZero();
    }

    @Test
    void testMatchingIsDeterministic() {
        DesignTokens tokens = new DesignTokens(Map.of("color_3C83F5", "#3C83F5"), Map.of("spacing_10", 10.0),
                Map.of("radius_40", 40.0), Map.of(), Map.of());

        assertThat(matcher.matchTokens(tokens, project)).isEqualTo(matcher.matchTokens(tokens, project));
    }

    @ParameterizedTest
    @CsvSource({
            "16, spacing.md",
            "15, spacing.md",
            "5, spacing.xs",
            "19, spacing.md",
            "20, spacing.lg",
            "30, spacing.lg"
    })
    void testSpacingTolerance(double value, String expected) {
        assertThat(numericMatcher.matchSpacing(value, project.getSpacing())).contains(expected);
    }

    @Test
    void testSpacingOutsideToleranceIsUnmatched() {
        assertThat(numericMatcher.matchSpacing(12, project.getSpacing())).isEmpty();
        assertThat(numericMatcher.matchSpacing(40, project.getSpacing())).isEmpty();
    }

    @Test
    void testSpacingTieGoesToSimplestPath() {
        Map<Double, String> spacing = Map.of(9.0, "spacing.scale.nine", 11.0, "gap");

        assertThat(numericMatcher.matchSpacing(10, spacing)).contains("gap");
    }

    @Test
    void testLargeRadiusPrefersFullToken() {
        assertThat(numericMatcher.matchRadius(50, project.getRadii())).contains("radii.full");
    }

    @Test
    void testLargeRadiusWithoutFullTokenUsesNearestLargeToken() {
        Map<Double, String> radii = Map.of(8.0, "radii.md", 48.0, "radii.xl", 96.0, "radii.xxl");

        assertThat(numericMatcher.matchRadius(32, radii)).contains("radii.xl");
    }

    @Test
    void testSmallRoundNamedTokenIsNotAPill() {
        Map<Double, String> radii = Map.of(4.0, "radii.roundedSm", 48.0, "radii.xl");

        assertThat(numericMatcher.matchRadius(40, radii)).contains("radii.xl");
    }

    @Test
    void testSmallRadiusTolerance() {
        assertThat(numericMatcher.matchRadius(7, project.getRadii())).contains("radii.md");
        assertThat(numericMatcher.matchRadius(12, project.getRadii())).isEmpty();
    }

    @Test
    void testFuzzyTypographyMatch() {
        assertThat(matcher.matchTypography(TypographyKey.of("inter", 17, 420, 25), project.getTypography()))
                .contains("typography.body");
        assertThat(matcher.matchTypography(TypographyKey.of("Inter", 16, 600, 24), project.getTypography()))
                .isEmpty();
        assertThat(matcher.matchTypography(TypographyKey.of("Inter", 18, 400, 24), project.getTypography()))
                .isEmpty();
    }

    @Test
    void testTypographyKeyFormat() {
        TypographyKey key = TypographyKey.of("SF Pro", 15.5, 590, 20.4);

        assertThat(key.toString()).isEqualTo("SF Pro:15.5:600:20");
        assertThat(TypographyKey.parse("Font:With:Colons:14:400:18")).contains(TypographyKey.of("Font:With:Colons", 14, 400, 18));
        assertThat(TypographyKey.parse("Inter:big:400:18")).isEmpty();
        assertThat(TypographyKey.parse("Inter:16")).isEmpty();
    }
}
