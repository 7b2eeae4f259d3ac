package com.screenir.compiler.detection;

import lombok.Value;

import java.util.Map;

/**
 * Style overrides for one state value: properties of the instance root and of its
 * text descendants.
 */
@Value
public class StateStyles {
    Map<String, Object> containerStyles;
    Map<String, Object> textStyles;
}
