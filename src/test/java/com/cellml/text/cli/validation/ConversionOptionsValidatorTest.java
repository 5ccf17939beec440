package com.cellml.text.cli.validation;

import com.cellml.text.cli.exception.OptionsValidationException;
import com.cellml.text.cli.model.ConversionOptions;
import com.cellml.text.cli.model.ValidatedConversionOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConversionOptionsValidator.
 */
class ConversionOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ConversionOptionsValidator validator = new ConversionOptionsValidator();

    @Test
    void testValidOptionsWithoutOutput() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.txt"), "x");

        ValidatedConversionOptions validated = validator.validate(options(input.toString()));

        assertThat(validated.getInputPath()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.isWriteToStdout()).isTrue();
    }

    @Test
    void testAllErrorsAreCollected() throws IOException {
        Path existing = Files.writeString(tempDir.resolve("out.xml"), "old");

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(options(tempDir.resolve("missing.txt").toString(), "-o", existing.toString()),
                        List.of("Tab size must be in range 1-8. Got: 0")),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getErrors().get(0)).startsWith("Input file does not exist:");
        assertThat(e.getErrors().get(1)).endsWith("Use --force to overwrite.");
        assertThat(e.getErrors().get(2)).startsWith("Tab size");
    }

    @Test
    void testForceAllowsExistingOutput() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.txt"), "x");
        Path output = Files.writeString(tempDir.resolve("out.xml"), "old");

        ValidatedConversionOptions validated = validator.validate(
                options(input.toString(), "-o", output.toString(), "-f"));

        assertThat(validated.getOutputPath()).isEqualTo(output.toAbsolutePath().normalize());
    }

    @Test
    void testInputDirectoryAndSameOutputAreRejected() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.txt"), "x");

        assertThatThrownBy(() -> validator.validate(options(tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("Input path is a directory");
        assertThatThrownBy(() -> validator.validate(options(input.toString(), "-o", input.toString(), "-f")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("Output file must differ from the input file");
    }

    private static ConversionOptions options(String... args) {
        return CommandLine.populateCommand(new ConversionOptions(), args);
    }
}
