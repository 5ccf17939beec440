package com.cellml.text.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cellml.text.cli.exception.OptionsValidationException;
import com.cellml.text.cli.model.ConversionOptions;
import com.cellml.text.cli.model.ValidatedConversionOptions;

public class ConversionOptionsValidator {

	public ValidatedConversionOptions validate(ConversionOptions o) {
		return validate(o, List.of());
	}

	/**
	 * @param commandErrors problems already found in options specific to one command
	 */
	public ValidatedConversionOptions validate(ConversionOptions o, List<String> commandErrors) {
		List<String> errors = new ArrayList<>();

		Path inputPath = null;
		if (o.getInput() == null) {
			errors.add("Input file is required.");
		} else {
			inputPath = o.getInput().toAbsolutePath().normalize();
			if (!Files.exists(inputPath)) {
				errors.add("Input file does not exist: " + inputPath);
			} else if (Files.isDirectory(inputPath)) {
				errors.add("Input path is a directory: " + inputPath);
			} else if (!Files.isReadable(inputPath)) {
				errors.add("Input file is not readable: " + inputPath);
			}
		}

		Path outputPath = null;
		if (o.getOutput() != null) {
			outputPath = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputPath)) {
				errors.add("Output path is a directory: " + outputPath);
			} else if (outputPath.equals(inputPath)) {
				errors.add("Output file must differ from the input file: " + outputPath);
			} else if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		errors.addAll(commandErrors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return new ValidatedConversionOptions(inputPath, outputPath);
	}
}
