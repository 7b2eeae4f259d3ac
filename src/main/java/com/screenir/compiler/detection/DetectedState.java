package com.screenir.compiler.detection;

import lombok.NonNull;
import lombok.Value;

/**
 * A state found among the items of a list or the instances of a component.
 */
@Value
public class DetectedState {

    public enum Source {
        LIST,
        COMPONENT
    }

    @NonNull
    Source source;

    /**
     * List container id or component name.
     */
    @NonNull
    String ownerId;

    @NonNull
    SemanticState state;

    double confidence;
}
