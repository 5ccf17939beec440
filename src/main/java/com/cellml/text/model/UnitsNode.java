package com.cellml.text.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A named unit definition ({@code units} element) built from {@link UnitNode} factors.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class UnitsNode extends CellmlNode {
    private String name;
    private List<UnitNode> units = new ArrayList<>();

    public UnitsNode(String name) {
        this.name = name;
    }

    public void addUnit(UnitNode unit) {
        units.add(unit);
    }

    @Override
    public String getTagName() {
        return "units";
    }

    @Override
    public <R> R accept(CellmlNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
