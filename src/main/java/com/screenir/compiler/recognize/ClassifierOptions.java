package com.screenir.compiler.recognize;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ClassifierOptions {

    @Builder.Default
    double iconMinSize = 8;

    @Builder.Default
    double iconMaxSize = 48;

    /**
     * Collapse runs of similarly named siblings into Repeater nodes.
     */
    @Builder.Default
    boolean groupRepeaters = false;

    public static ClassifierOptions defaults() {
        return ClassifierOptions.builder().build();
    }
}
