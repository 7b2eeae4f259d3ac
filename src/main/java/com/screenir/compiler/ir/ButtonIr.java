package com.screenir.compiler.ir;

import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.model.raw.BoundingBox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public final class ButtonIr implements IrNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    BoundingBox boundingBox;

    @NonNull
    String styleRef;

    @NonNull
    String label;

    /**
     * Style ref of the icon child, if the button has one.
     */
    String iconRef;

    @NonNull
    ButtonVariant variant;

    LayoutMeta layout;

    @Singular
    List<IrNode> children;

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.BUTTON;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
