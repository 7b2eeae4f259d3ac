package com.screenir.compiler.ir;

import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public final class TextIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    @NonNull
    String text;

    /**
     * Identifier under which the text can be bound to a property.
     */
    String propName;

    String defaultValue;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.TEXT;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<IrNode> getChildren() {
        return List.of();
    }
}
