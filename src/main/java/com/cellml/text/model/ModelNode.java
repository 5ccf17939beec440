package com.cellml.text.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Root of a CellML model: unit definitions followed by components.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class ModelNode extends CellmlNode {
    private String name;
    private List<UnitsNode> units = new ArrayList<>();
    private List<ComponentNode> components = new ArrayList<>();

    public ModelNode(String name) {
        this.name = name;
    }

    public void addUnits(UnitsNode definition) {
        units.add(definition);
    }

    public void addComponent(ComponentNode component) {
        components.add(component);
    }

    /**
     * Get all top-level equations of every component, in document order.
     */
    public List<MathElement> getAllEquations() {
        List<MathElement> equations = new ArrayList<>();
        for (ComponentNode component : components) {
            for (MathNode math : component.getMaths()) {
                equations.addAll(math.getChildren());
            }
        }
        return equations;
    }

    /**
     * Find the equation whose recorded source span covers the given line.
     *
     * @param attribute the source-line attribute name the parser was configured with
     * @param line      1-based source line
     */
    public Optional<ApplyNode> findEquationAtLine(String attribute, int line) {
        for (MathElement equation : getAllEquations()) {
            if (equation instanceof ApplyNode apply) {
                SourceSpan span = SourceSpan.parse(apply.getAnnotation(attribute));
                if (span != null && span.contains(line)) {
                    return Optional.of(apply);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String getTagName() {
        return "model";
    }

    @Override
    public <R> R accept(CellmlNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
