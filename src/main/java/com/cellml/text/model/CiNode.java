package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * MathML identifier ({@code ci}).
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class CiNode extends MathElement {
    private String name;

    @Override
    public String getTagName() {
        return "ci";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
