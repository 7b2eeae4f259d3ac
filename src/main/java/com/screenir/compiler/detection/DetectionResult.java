package com.screenir.compiler.detection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DetectionResult {

    @Singular
    List<ListHint> lists;

    @Singular
    List<ComponentHint> components;

    @Singular
    List<DetectedState> states;

    public static DetectionResult empty() {
        return DetectionResult.builder().build();
    }

    public boolean isEmpty() {
        return lists.isEmpty() && components.isEmpty() && states.isEmpty();
    }
}
