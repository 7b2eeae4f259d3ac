package com.screenir.compiler.cli.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Raised before compiling when the compile options are unusable. Holds every
 * problem found, and the design document they were given for (null when none was).
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient Path designDocument;
	private final List<String> errors;

	public OptionsValidationException(Path designDocument, List<String> errors) {
		super(summary(designDocument, errors.size()));
		this.designDocument = designDocument;
		this.errors = List.copyOf(errors);
	}

	private static String summary(Path designDocument, int count) {
		String target = designDocument == null ? "design document" : designDocument.toString();
		return "Cannot compile " + target + ": " + count + " invalid option" + (count == 1 ? "" : "s");
	}

	public Path getDesignDocument() {
		return designDocument;
	}

	public List<String> getErrors() {
		return errors;
	}
}
