package com.screenir.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.screenir.compiler.cli.CompileCommand;
import com.screenir.compiler.cli.exception.OptionsValidationException;
import com.screenir.compiler.cli.model.CompileOptions;
import com.screenir.compiler.cli.model.ValidatedCompileOptions;

public class CompileOptionsValidator {

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = null;
		if (o.getInput() == null) {
			errors.add("Design document is required (--input / -i).");
		} else if (!existsFile(o.getInput())) {
			errors.add("Design document does not exist or is not a file: " + o.getInput());
		} else {
			input = o.getInput().toAbsolutePath().normalize();
		}

		Path theme = null;
		if (o.getTheme() != null) {
			if (!existsFile(o.getTheme())) {
				errors.add("Theme file does not exist or is not a file: " + o.getTheme());
			} else {
				theme = o.getTheme().toAbsolutePath().normalize();
			}
		}

		if (!(o.getColorThreshold() > 0)) {
			errors.add("Color threshold must be > 0. Got: " + o.getColorThreshold());
		}

		List<String> ignorePatterns = new ArrayList<>();
		if (o.getIgnorePatterns() != null) {
			for (String pattern : o.getIgnorePatterns()) {
				if (isBlank(pattern)) {
					errors.add("Ignore patterns must not be blank.");
				} else {
					ignorePatterns.add(pattern.trim());
				}
			}
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		} else if (!o.isForce()) {
			for (String name : CompileCommand.OUTPUT_FILES) {
				if (CompileCommand.REPORT_FILE.equals(name) && !o.isReport()) {
					continue;
				}
				Path existing = normalizedOutputDir.resolve(name);
				if (Files.exists(existing)) {
					errors.add("Output file already exists: " + existing + ". Use --force to overwrite.");
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(o.getInput(), errors);
		}

		return new ValidatedCompileOptions(input, theme, normalizedOutputDir, List.copyOf(ignorePatterns));
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
