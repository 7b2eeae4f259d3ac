package com.screenir.compiler.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.screenir.compiler.cli.model.CompileOptions;
import com.screenir.compiler.cli.model.CompileResult;
import com.screenir.compiler.cli.model.ValidatedCompileOptions;

/**
 * Responsible only for printing CLI output for the "compile" command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(CompileOptions o, ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("Screen IR Compiler");
        log.info("=================================================");
        log.info("Design Document: {}", v.getInputFile());
        log.info("Theme: {}", v.getThemeFile() != null ? v.getThemeFile() : "None");
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Ignore Patterns: {}", v.getIgnorePatterns().isEmpty() ? "defaults" : v.getIgnorePatterns());
        log.info("Color Threshold: {}", o.getColorThreshold());
        log.info("Group Repeaters: {}", o.isGroupRepeaters());
        log.info("Flatten Wrappers: {}", o.isFlattenWrappers());
        log.info("=================================================");
    }

    public void printSuccess(CompileResult result) {
        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Screen: {}", result.getScreenName());
        if (result.isEmptyScreen()) {
            log.info("  Nothing left after normalization; wrote an empty screen");
        }
        log.info("IR Nodes: {}", result.getIrNodeCount());
        log.info("Styles: {}", result.getStyleCount());

        log.info("");
        log.info("Detection Summary:");
        log.info("  Lists: {}", result.getListCount());
        log.info("  Repeated Components: {}", result.getComponentCount());
        log.info("  States: {}", result.getStateCount());

        log.info("");
        log.info("Token Mapping Summary:");
        log.info("  Design Tokens: {}", result.getTokenCount());
        log.info("  Project Tokens: {}", result.getProjectTokenCount());
        log.info("  Matched: {}", result.getMatchedTokenCount());

        log.info("");
        log.info("Files Written:");
        for (Path file : result.getWrittenFiles()) {
            log.info("  {}", file);
        }
        log.info("=================================================");
    }

    public void printFailure(CompileResult result) {
        log.error("Compilation failed: {}", result.getErrorMessage());
    }
}
