package com.cellml.text.parser;

import java.util.List;

import com.cellml.text.model.ModelNode;

import lombok.Builder;
import lombok.Value;

/**
 * Result of parsing CellML Text.
 *
 * Either {@code xml} is non-null and {@code errors} is empty, or {@code xml} is null
 * and {@code errors} holds exactly one entry. {@code model} is the live tree, source-line
 * annotations included, and is null on failure.
 */
@Value
@Builder
public class ParseResult {
    String xml;
    ModelNode model;
    @Builder.Default
    List<ParserError> errors = List.of();
    @Builder.Default
    List<LexicalDiagnostic> warnings = List.of();

    public static ParseResult success(String xml, ModelNode model, List<LexicalDiagnostic> warnings) {
        return ParseResult.builder()
                .xml(xml)
                .model(model)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static ParseResult failure(ParserError error, List<LexicalDiagnostic> warnings) {
        return ParseResult.builder()
                .errors(List.of(error))
                .warnings(List.copyOf(warnings))
                .build();
    }

    public boolean isSuccess() {
        return xml != null;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
