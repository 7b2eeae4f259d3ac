package com.screenir.compiler.detection;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A container whose children are structurally interchangeable and can be rendered
 * from one item template.
 */
@Value
@Builder
public class ListHint {

    @NonNull
    String containerId;

    /**
     * Item ids in source order.
     */
    @Singular
    List<String> itemIds;

    @NonNull
    Orientation orientation;

    @NonNull
    String itemType;
}
