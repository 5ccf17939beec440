package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Bound variable of a derivative: the {@code t} in {@code dV/dt}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class BvarNode extends MathElement {
    private MathElement variable;

    @Override
    public String getTagName() {
        return "bvar";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
