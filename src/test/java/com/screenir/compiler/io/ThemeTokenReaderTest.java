package com.screenir.compiler.io;

import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.mapping.ProjectTokens;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ThemeTokenReader.
 */
class ThemeTokenReaderTest {

    private static final String THEME = """
            {
              "theme": {
                "colors": {
                  "primary": "#3b82f6",
                  "background": "#FFFFFF",
                  "surface": "#ffffff",
                  "overlay": "#00000080",
                  "brandName": "blue"
                },
                "spacing": { "sm": 8, "md": 16 },
                "layout": { "gap": 4, "borderRadius": 6 },
                "radii": { "md": 8, "full": 9999 },
                "fontScale": 1.2,
                "typography": {
                  "body": { "fontFamily": "Inter", "fontSize": 16, "fontWeight": "regular", "lineHeight": 24 },
                  "heading": { "fontFamily": "Inter", "fontSize": 24, "fontWeight": "bold" }
                },
                "shadows": {
                  "card": { "offsetX": 0, "offsetY": 2, "blur": 8 },
                  "modal": { "x": 0, "y": 8, "radius": 24, "spread": -4 }
                }
              }
            }
            """;

    private final ThemeTokenReader reader = new ThemeTokenReader();

    @Test
    void testReadsColors() {
        ProjectTokens tokens = reader.parse(THEME);

        assertThat(tokens.getColors())
                .containsEntry("#3B82F6", "theme.colors.primary")
                .containsEntry("#FFFFFF", "theme.colors.background")
                .containsEntry("#00000080", "theme.colors.overlay")
                .hasSize(3);
    }

    @Test
    void testClassifiesNumbersByPath() {
        ProjectTokens tokens = reader.parse(THEME);

        assertThat(tokens.getSpacing())
                .containsEntry(8.0, "theme.spacing.sm")
                .containsEntry(16.0, "theme.spacing.md")
                .containsEntry(4.0, "theme.layout.gap")
                .hasSize(3);
        assertThat(tokens.getRadii())
                .containsEntry(6.0, "theme.layout.borderRadius")
                .containsEntry(8.0, "theme.radii.md")
                .containsEntry(9999.0, "theme.radii.full");
    }

    @Test
    void testReadsTypographyAndShadowObjects() {
        ProjectTokens tokens = reader.parse(THEME);

        assertThat(tokens.getTypography())
                .containsEntry("Inter:16:400:24", "theme.typography.body")
                .containsEntry("Inter:24:700:29", "theme.typography.heading");
        assertThat(tokens.getShadows())
                .containsEntry("0,2,8,0", "theme.shadows.card")
                .containsEntry("0,8,24,-4", "theme.shadows.modal");
        assertThat(tokens.size()).isEqualTo(13);
    }

    @Test
    void testUnwrappedThemeStillUsesThemePrefix() {
        ProjectTokens tokens = reader.parse("""
                { "colors": { "text": "#111827" }, "spacing": { "lg": 24 } }
                """);

        assertThat(tokens.getColors()).containsEntry("#111827", "theme.colors.text");
        assertThat(tokens.getSpacing()).containsEntry(24.0, "theme.spacing.lg");
    }

    @Test
    void testEmptyThemeGivesNoTokens() {
        assertThat(reader.parse("{}").isEmpty()).isTrue();
    }

    @Test
    void testRejectsNonObjectTheme() {
        assertThatThrownBy(() -> reader.parse("\"#FFFFFF\""))
                .isInstanceOf(DesignDocumentException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> reader.parse("{ \"colors\": "))
                .isInstanceOf(DesignDocumentException.class)
                .hasMessageContaining("Malformed theme");
    }
}
