package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Placeholder for a MathML element outside the handled subset. Only its tag is kept.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class UnsupportedNode extends MathElement {
    private String tag;

    @Override
    public String getTagName() {
        return tag;
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
