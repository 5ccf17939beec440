package com.cellml.text.model;

import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Empty MathML constant element such as {@code <pi/>}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class ConstantNode extends MathElement {
    public static final Set<String> NAMES = Set.of(
            "pi", "exponentiale", "true", "false", "infinity", "notanumber");

    private String name;

    public static boolean isConstant(String tag) {
        return NAMES.contains(tag);
    }

    @Override
    public String getTagName() {
        return name;
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
