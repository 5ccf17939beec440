package com.cellml.text.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * One factor of a unit definition. Modifiers are optional and null when absent.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitNode extends CellmlNode {
    private String units;
    private String prefix;
    private String exponent;
    private String multiplier;

    @Override
    public String getTagName() {
        return "unit";
    }

    @Override
    public <R> R accept(CellmlNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
