package com.screenir.compiler;

import com.screenir.compiler.cli.CompileCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Screen IR Compiler.
 * Turns an exported design document into a semantic screen IR, with list, component
 * and state hints and a mapping of its design values onto the project's theme tokens.
 */
public class ScreenIrCompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
