package com.cellml.text.report;

/**
 * Failure to load or process a report template.
 */
public class ReportRenderException extends RuntimeException {

    public ReportRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
