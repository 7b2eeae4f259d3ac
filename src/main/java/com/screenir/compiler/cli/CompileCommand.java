package com.screenir.compiler.cli;

import com.screenir.compiler.cli.exception.OptionsValidationException;
import com.screenir.compiler.cli.model.CompileOptions;
import com.screenir.compiler.cli.model.CompileResult;
import com.screenir.compiler.cli.model.ValidatedCompileOptions;
import com.screenir.compiler.cli.output.CompileResultsPrinter;
import com.screenir.compiler.cli.validation.CompileOptionsValidator;
import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.exception.InvalidDesignTreeException;
import com.screenir.compiler.io.DesignDocumentReader;
import com.screenir.compiler.io.ScreenIrWriter;
import com.screenir.compiler.io.ThemeTokenReader;
import com.screenir.compiler.mapping.ProjectTokens;
import com.screenir.compiler.mapping.TokenMappings;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.normalize.Conventions;
import com.screenir.compiler.pipeline.PipelineOptions;
import com.screenir.compiler.pipeline.ScreenAnalysis;
import com.screenir.compiler.pipeline.ScreenIr;
import com.screenir.compiler.pipeline.ScreenIrPipeline;
import com.screenir.compiler.recognize.ClassifierOptions;
import com.screenir.compiler.report.ScreenReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command that compiles one exported design document into a screen IR.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        version = "screen-ir-compiler 1.0.0",
        description = "Compiles a design document into a semantic screen IR with detection hints and token mappings."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    public static final String SCREEN_IR_FILE = "screen-ir.json";
    public static final String DETECTION_FILE = "detection.json";
    public static final String TOKEN_MAPPINGS_FILE = "token-mappings.json";
    public static final String REPORT_FILE = "screen-report.md";

    public static final List<String> OUTPUT_FILES =
            List.of(SCREEN_IR_FILE, DETECTION_FILE, TOKEN_MAPPINGS_FILE, REPORT_FILE);

    @Mixin
    private CompileOptions options;

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error(e.getMessage());
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        CompileResult result = compile(validated);
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }

    CompileResult compile(ValidatedCompileOptions validated) {
        try {
            RawNode document = new DesignDocumentReader().read(validated.getInputFile());
            ProjectTokens projectTokens = validated.getThemeFile() != null
                    ? new ThemeTokenReader().read(validated.getThemeFile())
                    : ProjectTokens.empty();

            ScreenIrPipeline pipeline = new ScreenIrPipeline(pipelineOptions(validated, projectTokens));
            ScreenAnalysis analysis = pipeline.compile(document);

            return writeOutputs(validated.getNormalizedOutputDir(), analysis, projectTokens);
        } catch (DesignDocumentException | InvalidDesignTreeException e) {
            log.debug("Compilation aborted", e);
            return CompileResult.failure(e.getMessage());
        }
    }

    PipelineOptions pipelineOptions(ValidatedCompileOptions validated, ProjectTokens projectTokens) {
        Conventions conventions = Conventions.defaults();
        if (!validated.getIgnorePatterns().isEmpty()) {
            conventions = conventions.withIgnorePatterns(validated.getIgnorePatterns());
        }
        conventions = conventions.toBuilder()
                .flattenWrapperGroups(options.isFlattenWrappers())
                .build();

        ClassifierOptions classifierOptions = ClassifierOptions.builder()
                .groupRepeaters(options.isGroupRepeaters())
                .build();

        return PipelineOptions.builder()
                .conventions(conventions)
                .classifierOptions(classifierOptions)
                .colorThreshold(options.getColorThreshold())
                .projectTokens(projectTokens)
                .build();
    }

    private CompileResult writeOutputs(Path outputDir, ScreenAnalysis analysis, ProjectTokens projectTokens) {
        ScreenIrWriter writer = new ScreenIrWriter();
        ScreenIr screen = analysis.getScreen();
        TokenMappings mappings = analysis.getTokenMappings();

        CompileResult.CompileResultBuilder result = CompileResult.builder()
                .success(true)
                .screenName(screen.getName())
                .irNodeCount(screen.getRoot().countNodes())
                .styleCount(screen.getStylesBundle().getStyles().size())
                .tokenCount(mappings.totalCount())
                .projectTokenCount(projectTokens.size())
                .matchedTokenCount(mappings.matchedCount())
                .listCount(analysis.getDetection().getLists().size())
                .componentCount(analysis.getDetection().getComponents().size())
                .stateCount(analysis.getDetection().getStates().size())
                .emptyScreen(screen.getStylesBundle().getStyles().isEmpty());

        Path screenFile = outputDir.resolve(SCREEN_IR_FILE);
        writer.write(screenFile, screen);
        result.writtenFile(screenFile);

        Path detectionFile = outputDir.resolve(DETECTION_FILE);
        writer.write(detectionFile, analysis.getDetection());
        result.writtenFile(detectionFile);

        Path mappingsFile = outputDir.resolve(TOKEN_MAPPINGS_FILE);
        writer.write(mappingsFile, mappings);
        result.writtenFile(mappingsFile);

        if (options.isReport()) {
            Path reportFile = outputDir.resolve(REPORT_FILE);
            new ScreenReportGenerator().write(reportFile, analysis);
            result.writtenFile(reportFile);
        }
        return result.build();
    }
}
