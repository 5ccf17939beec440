package com.cellml.text.cli.exception;

import java.util.List;

/**
 * The input could be read but not converted, e.g. a CellML Text syntax error.
 */
public class ConversionFailedException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public ConversionFailedException(List<String> errors) {
		super(String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public ConversionFailedException(String error) {
		this(List.of(error));
	}

	public List<String> getErrors() {
		return errors;
	}
}
