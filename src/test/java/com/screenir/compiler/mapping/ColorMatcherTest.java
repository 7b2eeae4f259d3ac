package com.screenir.compiler.mapping;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ColorMatcher, HexColor and ColorSpace.
 */
class ColorMatcherTest {

    private final ColorMatcher matcher = new ColorMatcher();

    @Test
    void testExactMatch() {
        Map<String, String> project = Map.of("#3B82F6", "colors.primary");

        assertThat(matcher.match("#3B82F6", project)).isEqualTo("colors.primary");
        assertThat(matcher.match("#3b82f6", project)).isEqualTo("colors.primary");
    }

    @Test
    void testExactMatchPrefersSimplestPath() {
        Map<String, String> project = new LinkedHashMap<>();
        project.put("#3b82f6", "colors.brand.blue.500");
        project.put("#3B82F6", "colors.primary");

        assertThat(matcher.match("#3B82F6", project)).isEqualTo("colors.primary");
    }

    @Test
    void testCloseColorWithinThreshold() {
        Map<String, String> project = Map.of("#3B82F6", "colors.primary", "#22C55E", "colors.success");

        assertThat(matcher.match("#3C83F5", project)).isEqualTo("colors.primary");
    }

    @Test
    void testDistantColorIsLeftUnchanged() {
        Map<String, String> project = Map.of("#22C55E", "colors.success");

        assertThat(ColorSpace.deltaE76(HexColor.parse("#3B82F6").orElseThrow(), HexColor.parse("#22C55E").orElseThrow()))
                .isGreaterThan(60);
        assertThat(matcher.findMatch("#3B82F6", project)).isEmpty();
        assertThat(matcher.match("#3B82F6", project)).isEqualTo("#3B82F6");
    }

    @Test
    void testThresholdIsConfigurable() {
        Map<String, String> project = Map.of("#3B82F6", "colors.primary");

        assertThat(new ColorMatcher(60).findMatch("#6366F1", project)).contains("colors.primary");
        assertThat(new ColorMatcher(1).findMatch("#6366F1", project)).isEmpty();
    }

    @Test
    void testVeryDarkFallsBackToTextToken() {
        Map<String, String> project = Map.of("#000000", "colors.text", "#3B82F6", "colors.primary");

        assertThat(matcher.match("#1F2937", project)).isEqualTo("colors.text");
    }

    @Test
    void testVeryLightFallsBackToBackgroundToken() {
        Map<String, String> project = Map.of("#E0E0E0", "colors.background", "#3B82F6", "colors.primary");

        assertThat(matcher.match("#FAFAFA", project)).isEqualTo("colors.background");
    }

    @Test
    void testOpaqueSourceIgnoresTranslucentTokens() {
        Map<String, String> project = Map.of("#3B82F680", "colors.primaryMuted");

        assertThat(matcher.findMatch("#3B82F6", project)).isEmpty();
        assertThat(matcher.findMatch("#3B82F680", project)).contains("colors.primaryMuted");
    }

    @Test
    void testTranslucentSourcePrefersTokenWithSameAlpha() {
        Map<String, String> project = new LinkedHashMap<>();
        project.put("#3B82F6", "theme.colors.primary");
        project.put("#3B82F680", "theme.colors.overlay.primary50");

        assertThat(matcher.match("#3B82F680", project)).isEqualTo("theme.colors.overlay.primary50");
        assertThat(matcher.match("#3B82F6", project)).isEqualTo("theme.colors.primary");
    }

    @Test
    void testTranslucentSourceWithoutSameAlphaFallsBackToRgb() {
        Map<String, String> project = Map.of("#3B82F6", "theme.colors.primary", "#3B82F640", "theme.colors.tint");

        assertThat(matcher.match("#3B82F680", project)).isEqualTo("theme.colors.primary");
    }

    @Test
    void testUnparseableValuesAreSkipped() {
        Map<String, String> project = new LinkedHashMap<>();
        project.put("not-a-color", "colors.broken");
        project.put("#FFFFFF", "colors.white");

        assertThat(matcher.match("banana", project)).isEqualTo("banana");
        assertThat(matcher.match("#FFFFFF", project)).isEqualTo("colors.white");
    }

    @Test
    void testEmptyProjectNeverMatches() {
        assertThat(matcher.match("#3B82F6", Map.of())).isEqualTo("#3B82F6");
    }

    @ParameterizedTest
    @CsvSource({
            "#FFF, 255, 255, 255, 1.0",
            "#3B82F6, 59, 130, 246, 1.0",
            "#3B82F680, 59, 130, 246, 0.502",
            "'rgba(16, 24, 40, 0.5)', 16, 24, 40, 0.5",
            "'rgb(0,0,0)', 0, 0, 0, 1.0"
    })
    void testHexColorParsing(String value, int red, int green, int blue, double alpha) {
        HexColor color = HexColor.parse(value).orElseThrow();

        assertThat(color.getRed()).isEqualTo(red);
        assertThat(color.getGreen()).isEqualTo(green);
        assertThat(color.getBlue()).isEqualTo(blue);
        assertThat(color.getAlpha()).isCloseTo(alpha, within(0.01));
    }

    @Test
    void testColorSpaceExtremes() {
        HexColor white = HexColor.parse("#FFFFFF").orElseThrow();
        HexColor black = HexColor.parse("#000000").orElseThrow();

        assertThat(ColorSpace.deltaE76(white, black)).isCloseTo(100, within(0.5));
        assertThat(ColorSpace.relativeLuminance(white)).isCloseTo(1.0, within(0.001));
        assertThat(ColorSpace.relativeLuminance(black)).isZero();
    }
}
