package com.cellml.text.parser;

import lombok.Getter;

/**
 * Thrown on the first grammar violation. Caught once by {@link CellmlParser#parse(String)}.
 */
@Getter
public class CellmlSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public CellmlSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }
}
