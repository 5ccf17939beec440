package com.cellml.text.model;

/**
 * Base class for all nodes of a CellML model tree, MathML content included.
 */
public abstract class CellmlNode {

    /**
     * Local name of the XML element this node stands for.
     */
    public abstract String getTagName();

    public abstract <R> R accept(CellmlNodeVisitor<R> visitor);
}
