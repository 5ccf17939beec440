package com.cellml.text.parser;

import lombok.Value;

/**
 * A syntax error reported by {@link CellmlParser}, with the 1-based line of the offending token.
 */
@Value
public class ParserError {
    int line;
    String message;

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
