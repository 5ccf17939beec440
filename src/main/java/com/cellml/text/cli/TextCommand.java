package com.cellml.text.cli;

import java.util.List;

import com.cellml.text.cli.exception.ConversionFailedException;
import com.cellml.text.generator.CellmlTextGenerator;
import com.cellml.text.generator.TextGeneratorOptions;
import com.cellml.text.model.ModelNode;
import com.cellml.text.xml.CellmlXmlReader;
import com.cellml.text.xml.XmlReadException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CellML 2.0 XML to CellML Text.
 */
@Command(
        name = "text",
        mixinStandardHelpOptions = true,
        description = "Converts a CellML 2.0 XML file to CellML Text."
)
public class TextCommand extends ConversionCommand {

    static final int MAX_TAB_SIZE = 8;

    @Option(names = { "--tab-size" }, defaultValue = "2", description = "Spaces per indentation level (default: 2)")
    private int tabSize;

    @Override
    protected void validateCommandOptions(List<String> errors) {
        if (tabSize < 1 || tabSize > MAX_TAB_SIZE) {
            errors.add("Tab size must be in range 1-" + MAX_TAB_SIZE + ". Got: " + tabSize);
        }
    }

    @Override
    protected String convert(String source) {
        ModelNode model;
        try {
            model = new CellmlXmlReader().read(source);
        } catch (XmlReadException e) {
            throw new ConversionFailedException(e.getMessage());
        }

        TextGeneratorOptions generatorOptions = TextGeneratorOptions.builder().tabSize(tabSize).build();
        return new CellmlTextGenerator(generatorOptions).generate(model);
    }
}
