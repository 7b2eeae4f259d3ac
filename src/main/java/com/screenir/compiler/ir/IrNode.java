package com.screenir.compiler.ir;

import com.screenir.compiler.model.raw.BoundingBox;

import java.util.List;
import java.util.function.Consumer;

/**
 * A node of the semantic IR: exactly one UI role per node.
 */
public sealed interface IrNode
        permits ContainerIr, TextIr, ImageIr, ButtonIr, CardIr, IconIr, ComponentIr, RepeaterIr {

    String getId();

    String getName();

    SemanticType getSemanticType();

    BoundingBox getBoundingBox();

    /**
     * Join key into the styles bundle.
     */
    String getStyleRef();

    List<IrNode> getChildren();

    <R> R accept(IrNodeVisitor<R> visitor);

    /**
     * Pre-order walk over this node and its descendants.
     */
    default void walk(Consumer<IrNode> action) {
        action.accept(this);
        for (IrNode child : getChildren()) {
            child.walk(action);
        }
    }

    default int countNodes() {
        int count = 1;
        for (IrNode child : getChildren()) {
            count += child.countNodes();
        }
        return count;
    }
}
