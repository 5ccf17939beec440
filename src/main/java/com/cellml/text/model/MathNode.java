package com.cellml.text.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A {@code math} block. Each child is one statement, usually an {@code apply(eq, lhs, rhs)}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class MathNode extends CellmlNode {
    private List<MathElement> children = new ArrayList<>();

    public void addChild(MathElement child) {
        children.add(child);
    }

    @Override
    public String getTagName() {
        return "math";
    }

    @Override
    public <R> R accept(CellmlNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
