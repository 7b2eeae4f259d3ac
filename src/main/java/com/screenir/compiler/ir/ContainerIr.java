package com.screenir.compiler.ir;

import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Generic grouping node; the default role.
 */
@Value
@Builder(toBuilder = true)
public final class ContainerIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    @NonNull
    LayoutMeta layout;

    @Singular
    List<IrNode> children;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.CONTAINER;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
