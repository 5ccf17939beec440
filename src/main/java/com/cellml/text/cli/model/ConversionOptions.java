package com.cellml.text.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Input and output options shared by every conversion command. No validation,
 * no execution logic, no printing.
 */
@Getter
public class ConversionOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "File to convert")
	private Path input;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;
}
