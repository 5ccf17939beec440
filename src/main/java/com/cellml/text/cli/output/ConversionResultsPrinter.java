package com.cellml.text.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.cli.model.ValidatedConversionOptions;

/**
 * Responsible only for reporting CLI progress and failures through the log.
 * Converted content itself goes to the command's output stream or file.
 */
public class ConversionResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultsPrinter.class);

    public void printStart(String commandName, ValidatedConversionOptions v) {
        log.info("cellml-text {}: {}", commandName, v.getInputPath());
    }

    public void printWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        log.warn("{} warning(s):", warnings.size());
        warnings.forEach(w -> log.warn("  {}", w));
    }

    public void printSuccess(ValidatedConversionOptions v, String content) {
        if (v.isWriteToStdout()) {
            log.debug("Wrote {} characters to standard output", content.length());
        } else {
            log.info("Wrote {} characters to {}", content.length(), v.getOutputPath());
        }
    }

    public void printConversionErrors(List<String> errors) {
        log.error("Conversion failed:");
        errors.forEach(e -> log.error("  {}", e));
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }
}
