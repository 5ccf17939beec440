package com.cellml.text.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized paths for a conversion. A null output path means standard output.
 */
@Data
@AllArgsConstructor
public class ValidatedConversionOptions {
    Path inputPath;
    Path outputPath;

    public boolean isWriteToStdout() {
        return outputPath == null;
    }
}
