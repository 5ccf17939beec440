package com.cellml.text.model;

/**
 * Visitor pattern interface for traversing a whole CellML model tree.
 */
public interface CellmlNodeVisitor<R> extends MathElementVisitor<R> {
    R visit(ModelNode model);
    R visit(UnitsNode units);
    R visit(UnitNode unit);
    R visit(ComponentNode component);
    R visit(VariableNode variable);
    R visit(MathNode math);
}
