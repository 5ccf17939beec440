package com.cellml.text.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.cli.exception.ConversionFailedException;
import com.cellml.text.cli.exception.OptionsValidationException;
import com.cellml.text.cli.model.ConversionOptions;
import com.cellml.text.cli.model.ValidatedConversionOptions;
import com.cellml.text.cli.output.ConversionResultsPrinter;
import com.cellml.text.cli.validation.ConversionOptionsValidator;
import com.cellml.text.util.FileWriteUtil;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Shared flow of every conversion: validate options, read the input, convert,
 * then write to the output file or to standard output.
 */
public abstract class ConversionCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConversionCommand.class);

    @Mixin
    protected ConversionOptions options;

    @Spec
    protected CommandSpec spec;

    protected final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            List<String> commandErrors = new ArrayList<>();
            validateCommandOptions(commandErrors);
            ValidatedConversionOptions validated = new ConversionOptionsValidator().validate(options, commandErrors);

            printer.printStart(spec.name(), validated);
            String source = FileWriteUtil.readString(validated.getInputPath());
            String content = convert(source);

            if (validated.isWriteToStdout()) {
                PrintWriter out = spec.commandLine().getOut();
                out.print(content);
                out.flush();
            } else {
                FileWriteUtil.safeWriteString(validated.getOutputPath(), content);
            }
            printer.printSuccess(validated, content);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (ConversionFailedException e) {
            printer.printConversionErrors(e.getErrors());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure during {}", spec.name(), e);
            return 1;
        }
    }

    /**
     * Add errors for options that only this command has.
     */
    protected void validateCommandOptions(List<String> errors) {
        // Nothing beyond the shared options by default
    }

    /**
     * @throws ConversionFailedException when the input cannot be converted
     */
    protected abstract String convert(String source);
}
