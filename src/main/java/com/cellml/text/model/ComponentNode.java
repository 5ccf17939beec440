package com.cellml.text.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A CellML component: declared variables and the math blocks relating them.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class ComponentNode extends CellmlNode {
    private String name;
    private List<VariableNode> variables = new ArrayList<>();
    private List<MathNode> maths = new ArrayList<>();

    public ComponentNode(String name) {
        this.name = name;
    }

    public void addVariable(VariableNode variable) {
        variables.add(variable);
    }

    public void addMath(MathNode math) {
        maths.add(math);
    }

    /**
     * The first math block of this component, created on demand.
     */
    public MathNode getOrCreateMath() {
        if (maths.isEmpty()) {
            maths.add(new MathNode());
        }
        return maths.get(0);
    }

    @Override
    public String getTagName() {
        return "component";
    }

    @Override
    public <R> R accept(CellmlNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
