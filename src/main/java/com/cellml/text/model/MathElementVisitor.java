package com.cellml.text.model;

/**
 * Visitor over MathML content nodes.
 */
public interface MathElementVisitor<R> {
    R visit(ApplyNode apply);
    R visit(CiNode ci);
    R visit(CnNode cn);
    R visit(PiecewiseNode piecewise);
    R visit(PieceNode piece);
    R visit(OtherwiseNode otherwise);
    R visit(BvarNode bvar);
    R visit(ConstantNode constant);
    R visit(UnsupportedNode unsupported);
}
