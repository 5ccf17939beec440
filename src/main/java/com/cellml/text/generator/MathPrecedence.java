package com.cellml.text.generator;

import lombok.experimental.UtilityClass;

/**
 * Binding strength of rendered MathML constructs, highest binds tightest.
 */
@UtilityClass
public class MathPrecedence {

    public static final int ATOMIC = 100;
    public static final int FUNCTION = 90;
    public static final int POWER = 80;
    public static final int PRODUCT = 70;
    public static final int SUM = 60;
    public static final int RELATIONAL = 50;
    public static final int UNKNOWN = 0;

    public static int of(String operator) {
        if (operator == null) {
            return UNKNOWN;
        }
        return switch (operator) {
            case "power" -> POWER;
            case "times", "divide" -> PRODUCT;
            case "plus", "minus" -> SUM;
            case "eq", "neq", "lt", "leq", "gt", "geq", "and", "or" -> RELATIONAL;
            case "root", "sqrt", "diff", "exp", "abs", "floor", "ceiling", "ceil" -> FUNCTION;
            default -> LatexGenerator.isNamedFunction(operator) ? FUNCTION : UNKNOWN;
        };
    }
}
