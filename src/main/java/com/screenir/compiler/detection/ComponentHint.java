package com.screenir.compiler.detection;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A subtree repeated often enough to be extracted into a reusable component.
 */
@Value
@Builder
public class ComponentHint {

    @NonNull
    String componentName;

    @Singular
    List<String> instanceIds;

    /**
     * Distinct values per variable prop, in first-seen order.
     */
    @Singular("propsVariation")
    Map<String, List<String>> propsVariations;
}
