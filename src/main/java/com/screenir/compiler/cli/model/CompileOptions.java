package com.screenir.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Design document JSON exported from the design tool")
	private Path input;

	@Option(names = { "--theme", "-t" }, description = "Project theme JSON to map design tokens onto")
	private Path theme;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = {
			"--ignore-pattern" }, description = "Layer name glob to drop (repeatable; replaces the default ignore set)")
	private List<String> ignorePatterns;

	@Option(names = {
			"--color-threshold" }, defaultValue = "8", description = "Maximum Delta-E for a fuzzy color match (default: 8)")
	private double colorThreshold;

	@Option(names = { "--group-repeaters" }, description = "Collapse similarly named sibling runs into Repeater nodes")
	private boolean groupRepeaters;

	@Option(names = { "--flatten-wrappers" }, description = "Hoist the children of style-less wrapper groups")
	private boolean flattenWrappers;

	@Option(names = { "--report" }, description = "Also write a Markdown summary (screen-report.md)")
	private boolean report;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

}
