package com.screenir.compiler.pipeline;

import com.screenir.compiler.mapping.ColorMatcher;
import com.screenir.compiler.mapping.ProjectTokens;
import com.screenir.compiler.normalize.Conventions;
import com.screenir.compiler.recognize.ClassifierOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-run configuration of {@link ScreenIrPipeline}.
 */
@Value
@Builder(toBuilder = true)
public class PipelineOptions {

    @NonNull
    @Builder.Default
    Conventions conventions = Conventions.defaults();

    @NonNull
    @Builder.Default
    ClassifierOptions classifierOptions = ClassifierOptions.defaults();

    /**
     * Maximum Delta-E for a fuzzy color match.
     */
    @Builder.Default
    double colorThreshold = ColorMatcher.DEFAULT_THRESHOLD;

    /**
     * Project token table; empty when the project has no theme.
     */
    @NonNull
    @Builder.Default
    ProjectTokens projectTokens = ProjectTokens.empty();

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }
}
