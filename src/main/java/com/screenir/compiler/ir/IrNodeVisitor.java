package com.screenir.compiler.ir;

/**
 * Visitor over the closed set of IR roles. Adding a role breaks every visitor at
 * compile time.
 */
public interface IrNodeVisitor<R> {
    R visit(ContainerIr container);
    R visit(TextIr text);
    R visit(ImageIr image);
    R visit(ButtonIr button);
    R visit(CardIr card);
    R visit(IconIr icon);
    R visit(ComponentIr component);
    R visit(RepeaterIr repeater);
}
