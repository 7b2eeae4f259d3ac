package com.screenir.compiler.cli.validation;

import com.screenir.compiler.cli.exception.OptionsValidationException;
import com.screenir.compiler.cli.model.CompileOptions;
import com.screenir.compiler.cli.model.ValidatedCompileOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CompileOptionsValidator.
 */
class CompileOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final CompileOptionsValidator validator = new CompileOptionsValidator();

    @Test
    void testValidOptionsAreNormalized() throws IOException {
        Path design = Files.writeString(tempDir.resolve("design.json"), "{}");

        ValidatedCompileOptions validated = validator.validate(
                options("-i", design.toString(), "-o", tempDir.resolve("out").toString(), "--ignore-pattern", " _* "));

        assertThat(validated.getInputFile()).isEqualTo(design.toAbsolutePath().normalize());
        assertThat(validated.getIgnorePatterns()).containsExactly("_*");
    }

    @Test
    void testAllProblemsAreReportedTogether() {
        Path missing = tempDir.resolve("missing.json");
        CompileOptions options = options("-i", missing.toString(), "-t", tempDir.resolve("nope.json").toString(),
                "--color-threshold", "0", "-o", tempDir.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> {
                    assertThat(e.getDesignDocument()).isEqualTo(missing);
                    assertThat(e.getMessage()).isEqualTo("Cannot compile " + missing + ": 3 invalid options");
                    assertThat(e.getErrors()).hasSize(3);
                    assertThat(e.getErrors().get(0)).startsWith("Design document does not exist");
                    assertThat(e.getErrors().get(2)).isEqualTo("Color threshold must be > 0. Got: 0.0");
                });
    }

    @Test
    void testSingleProblemSummary() throws IOException {
        Path design = Files.writeString(tempDir.resolve("design.json"), "{}");
        Path outputFile = Files.writeString(tempDir.resolve("taken"), "x");

        assertThatThrownBy(() -> validator.validate(options("-i", design.toString(), "-o", outputFile.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageEndingWith(": 1 invalid option");
    }

    private static CompileOptions options(String... args) {
        return CommandLine.populateCommand(new CompileOptions(), args);
    }
}
