package com.cellml.text.cli;

import java.util.List;

import com.cellml.text.cli.exception.ConversionFailedException;
import com.cellml.text.parser.CellmlParser;
import com.cellml.text.parser.ParseResult;
import com.cellml.text.parser.ParserError;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CellML Text to CellML 2.0 XML.
 */
@Command(
        name = "xml",
        mixinStandardHelpOptions = true,
        description = "Compiles a CellML Text file to CellML 2.0 XML."
)
public class XmlCommand extends ConversionCommand {

    @Option(names = { "--strict" }, description = "Treat skipped unknown characters as errors")
    private boolean strict;

    @Override
    protected String convert(String source) {
        ParseResult result = new CellmlParser().parse(source);

        List<String> warnings = result.getWarnings().stream()
                .map(w -> "line " + w.getLine() + ": " + w.getMessage())
                .toList();

        if (!result.isSuccess()) {
            throw new ConversionFailedException(result.getErrors().stream().map(ParserError::toString).toList());
        }
        if (strict && !warnings.isEmpty()) {
            throw new ConversionFailedException(warnings);
        }

        printer.printWarnings(warnings);
        return result.getXml() + "\n";
    }
}
