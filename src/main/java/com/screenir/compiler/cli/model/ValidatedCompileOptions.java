package com.screenir.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
	Path inputFile;
	Path themeFile;
	Path normalizedOutputDir;
	List<String> ignorePatterns;
}
