package com.screenir.compiler.report;

import com.screenir.compiler.DesignFixtures;
import com.screenir.compiler.mapping.ProjectTokens;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.pipeline.PipelineOptions;
import com.screenir.compiler.pipeline.ScreenAnalysis;
import com.screenir.compiler.pipeline.ScreenIrPipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ScreenReportGenerator.
 */
class ScreenReportGeneratorTest {

    private final ScreenReportGenerator generator = new ScreenReportGenerator();

    @Test
    void testRendersDetectionSections() {
        ScreenAnalysis analysis = new ScreenIrPipeline().compile(DesignFixtures.productsListScreen());

        String report = generator.render(analysis);

        assertThat(report)
                .startsWith("# Screen report: ProductsListScreen")
                .contains("- Screen id: `1:1`")
                .contains("| Card | 3 |")
                .contains("| `1:3` | 3 | vertical | ProductCardItem |")
                .contains("### ProductCard")
                .contains("- Instances: `2:1`, `2:2`, `2:3`")
                .contains("No states detected.")
                .doesNotContain("Safe area insets");
    }

    @Test
    void testRendersTokenMappings() {
        ProjectTokens project = ProjectTokens.builder()
                .color("#FFFFFF", "theme.colors.surface")
                .build();
        ScreenAnalysis analysis = new ScreenIrPipeline(PipelineOptions.builder().projectTokens(project).build())
                .compile(DesignFixtures.productsListScreen());

        String report = generator.render(analysis);

        assertThat(report)
                .contains("| `#FFFFFF` | theme.colors.surface |")
                .contains("| `#6B7280` | (unmatched) |")
                .contains("| Colors | 3 | 1 |");
    }

    @Test
    void testRendersEmptyScreen() {
        RawNode hidden = DesignFixtures.frame("9:9", "Hidden", 0, 0, 375, 812).visible(false).build();

        String report = generator.render(new ScreenIrPipeline().compile(hidden));

        assertThat(report)
                .contains("- IR nodes: 1")
                .contains("- Styles: 0")
                .contains("No lists detected.")
                .contains("No repeated components detected.");
    }

    @Test
    void testWritesReportFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("screen-report.md");

        generator.write(file, new ScreenIrPipeline().compile(DesignFixtures.productsListScreen()));

        assertThat(Files.readString(file)).contains("## Token mappings");
    }
}
