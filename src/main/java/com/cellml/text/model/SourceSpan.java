package com.cellml.text.model;

import lombok.Value;

/**
 * Inclusive range of source lines covered by one equation.
 * Written as {@code "7"} for a single line or {@code "7-9"} for a range.
 */
@Value
public class SourceSpan {
    int startLine;
    int endLine;

    public static SourceSpan of(int startLine, int endLine) {
        return new SourceSpan(startLine, Math.max(startLine, endLine));
    }

    /**
     * Parse an annotation value, returning null when it is absent or malformed.
     */
    public static SourceSpan parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            int dash = text.indexOf('-');
            if (dash < 0) {
                int line = Integer.parseInt(text.trim());
                return new SourceSpan(line, line);
            }
            return of(Integer.parseInt(text.substring(0, dash).trim()),
                    Integer.parseInt(text.substring(dash + 1).trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public String toString() {
        return startLine == endLine ? Integer.toString(startLine) : startLine + "-" + endLine;
    }
}
