package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * MathML number ({@code cn}).
 *
 * A non-null {@code exponent} marks the {@code type="e-notation"} form, where
 * {@code value} holds the mantissa. {@code units} is the CellML-namespaced units attribute.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CnNode extends MathElement {
    public static final String E_NOTATION = "e-notation";

    private String value;
    private String exponent;
    private String units;

    public static CnNode of(String value) {
        return CnNode.builder().value(value).build();
    }

    public boolean isENotation() {
        return exponent != null;
    }

    /**
     * The number as a single literal, e.g. {@code 1.5e3} for the e-notation form.
     */
    public String getLiteral() {
        return isENotation() ? value + "e" + exponent : value;
    }

    public boolean isNegative() {
        return value != null && value.trim().startsWith("-");
    }

    @Override
    public String getTagName() {
        return "cn";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
