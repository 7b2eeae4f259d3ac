package com.screenir.compiler.ir;

import lombok.Value;

/**
 * A property harvested from a component instance's content.
 */
@Value
public class ComponentProp {

    public enum Kind {
        STRING,
        IMAGE
    }

    Kind kind;
    String value;
    String defaultValue;
}
