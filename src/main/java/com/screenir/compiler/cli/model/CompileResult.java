package com.screenir.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Outcome of one compile run.
 */
@Data
@Builder
public class CompileResult {
	private boolean success;
	private String errorMessage;

	private String screenName;
	private int irNodeCount;
	private int styleCount;
	private int tokenCount;
	private int projectTokenCount;
	private int matchedTokenCount;
	private int listCount;
	private int componentCount;
	private int stateCount;
	private boolean emptyScreen;

	@Singular
	private List<Path> writtenFiles;

	public static CompileResult failure(String errorMessage) {
		return CompileResult.builder()
				.success(false)
				.errorMessage(errorMessage)
				.build();
	}
}
