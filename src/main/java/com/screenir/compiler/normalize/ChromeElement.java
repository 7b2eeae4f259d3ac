package com.screenir.compiler.normalize;

import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Value;

/**
 * A device chrome layer found in the design.
 */
@Value
public class ChromeElement {

    public enum Kind {
        STATUS_BAR,
        HOME_INDICATOR,
        SAFE_AREA,
        NAVIGATION_BAR
    }

    String id;
    String name;
    Kind kind;
    BoundingBox boundingBox;
}
