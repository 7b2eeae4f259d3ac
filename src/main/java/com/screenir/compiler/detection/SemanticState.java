package com.screenir.compiler.detection;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Style variation across sibling instances attributed to a UI state.
 */
@Value
@Builder
public class SemanticState {

    public enum PropType {
        BOOLEAN,
        ENUM
    }

    @NonNull
    StateType type;

    /**
     * e.g. {@code isSelected} or {@code variant}.
     */
    @NonNull
    String propName;

    @NonNull
    PropType propType;

    @NonNull
    Object defaultValue;

    /**
     * Instance id to state value, in instance order.
     */
    @Singular
    Map<String, Object> instanceStates;

    /**
     * State value (as text) to its style overrides.
     */
    @Singular
    Map<String, StateStyles> stateStyles;
}
