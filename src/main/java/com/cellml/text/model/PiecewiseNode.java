package com.cellml.text.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * MathML {@code piecewise}: ordered pieces and an optional trailing {@code otherwise}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
public class PiecewiseNode extends MathElement {
    private List<PieceNode> pieces = new ArrayList<>();
    private OtherwiseNode otherwise;

    public void addPiece(PieceNode piece) {
        pieces.add(piece);
    }

    @Override
    public String getTagName() {
        return "piecewise";
    }

    @Override
    public <R> R accept(MathElementVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
