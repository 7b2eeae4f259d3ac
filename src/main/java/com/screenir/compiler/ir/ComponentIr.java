package com.screenir.compiler.ir;

import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * An instance of a reusable design component.
 */
@Value
@Builder(toBuilder = true)
public final class ComponentIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    @NonNull
    String componentId;

    @NonNull
    String componentName;

    @Singular
    Map<String, ComponentProp> props;

    @NonNull
    LayoutMeta layout;

    @Singular
    List<IrNode> children;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.COMPONENT;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
