package com.cellml.text.parser;

import lombok.Value;

/**
 * A non-fatal anomaly found by the scanner, such as a character that starts no token.
 */
@Value
public class LexicalDiagnostic {
    int line;
    char character;

    public String getMessage() {
        return "Unknown character '" + character + "' skipped";
    }
}
