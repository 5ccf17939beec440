package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * One case of a piecewise expression. MathML order is value first, condition second.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class PieceNode extends MathElement {
    private MathElement value;
    private MathElement condition;

    @Override
    public String getTagName() {
        return "piece";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
