package com.screenir.compiler.detection;

import lombok.Value;

import java.util.Optional;

@Value
public class StateDetectionResult {

    private static final StateDetectionResult NONE = new StateDetectionResult(null, 0);

    SemanticState state;

    /**
     * 0 to 1; 0 when nothing was detected.
     */
    double confidence;

    public static StateDetectionResult none() {
        return NONE;
    }

    public boolean hasSemanticState() {
        return state != null;
    }

    public Optional<SemanticState> findState() {
        return Optional.ofNullable(state);
    }
}
