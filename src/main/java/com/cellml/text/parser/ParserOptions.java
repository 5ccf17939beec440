package com.cellml.text.parser;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link CellmlParser}.
 */
@Value
@Builder
public class ParserOptions {
    public static final String DEFAULT_SOURCE_LINE_ATTRIBUTE = "data-source-location";

    /**
     * Annotation name used to tag each equation's {@code apply} with its source line span.
     * Null or empty disables tagging. The annotation never reaches serialized XML.
     */
    @Builder.Default
    String sourceLineAttribute = DEFAULT_SOURCE_LINE_ATTRIBUTE;

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }

    public boolean isSourceTrackingEnabled() {
        return sourceLineAttribute != null && !sourceLineAttribute.isEmpty();
    }
}
