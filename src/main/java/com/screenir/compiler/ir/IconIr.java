package com.screenir.compiler.ir;

import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Small vector or image artwork, sized by its larger dimension.
 */
@Value
@Builder(toBuilder = true)
public final class IconIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    @NonNull
    String iconRef;

    double size;

    LayoutMeta layout;

    @Singular
    List<IrNode> children;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.ICON;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
