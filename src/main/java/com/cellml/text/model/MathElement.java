package com.cellml.text.model;

/**
 * Base class for MathML content nodes found inside a {@code math} block.
 */
public abstract class MathElement extends CellmlNode {

    public abstract <R> R accept(MathElementVisitor<R> visitor);

    @Override
    public final <R> R accept(CellmlNodeVisitor<R> visitor) {
        return accept((MathElementVisitor<R>) visitor);
    }
}
