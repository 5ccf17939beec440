package com.cellml.text.generator;

import lombok.Builder;
import lombok.Value;

/**
 * Formatting options for {@link CellmlTextGenerator}.
 */
@Value
@Builder
public class TextGeneratorOptions {
    public static final int DEFAULT_TAB_SIZE = 2;

    /**
     * Spaces per indentation level. Values below 1 fall back to the default.
     */
    @Builder.Default
    int tabSize = DEFAULT_TAB_SIZE;

    public static TextGeneratorOptions defaults() {
        return TextGeneratorOptions.builder().build();
    }

    public String getIndentUnit() {
        return " ".repeat(tabSize > 0 ? tabSize : DEFAULT_TAB_SIZE);
    }
}
