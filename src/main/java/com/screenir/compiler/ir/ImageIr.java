package com.screenir.compiler.ir;

import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public final class ImageIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    /**
     * Image asset reference; {@code null} for vector artwork.
     */
    String imageRef;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.IMAGE;
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
