package com.cellml.text.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * MathML {@code apply}: an operator (the first child in XML) applied to its arguments.
 *
 * Annotations are in-memory attributes such as the source-line span of an equation.
 * They take no part in equality and are never written to XML.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class ApplyNode extends MathElement {
    public static final String EQ = "eq";
    public static final String DIFF = "diff";

    private String operator;
    private List<MathElement> arguments = new ArrayList<>();
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Map<String, String> annotations = new LinkedHashMap<>();

    public ApplyNode(String operator) {
        this.operator = operator;
    }

    public static ApplyNode of(String operator, MathElement... arguments) {
        ApplyNode apply = new ApplyNode(operator);
        apply.arguments.addAll(Arrays.asList(arguments));
        return apply;
    }

    public void addArgument(MathElement argument) {
        arguments.add(argument);
    }

    public boolean isOperator(String name) {
        return name.equals(operator);
    }

    /**
     * True for {@code apply(eq, lhs, rhs)}, the shape of an assignment statement.
     */
    public boolean isEquation() {
        return isOperator(EQ) && arguments.size() == 2;
    }

    public Optional<BvarNode> findBvar() {
        return arguments.stream()
                .filter(BvarNode.class::isInstance)
                .map(BvarNode.class::cast)
                .findFirst();
    }

    /**
     * Arguments other than bound variables.
     */
    public List<MathElement> getOperands() {
        return arguments.stream()
                .filter(argument -> !(argument instanceof BvarNode))
                .toList();
    }

    public String getAnnotation(String name) {
        return name == null ? null : annotations.get(name);
    }

    public void setAnnotation(String name, String value) {
        annotations.put(name, value);
    }

    @Override
    public String getTagName() {
        return "apply";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
