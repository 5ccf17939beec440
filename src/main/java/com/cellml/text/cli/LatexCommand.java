package com.cellml.text.cli;

import java.util.stream.Collectors;

import com.cellml.text.cli.exception.ConversionFailedException;
import com.cellml.text.generator.ComponentEquations;
import com.cellml.text.generator.LatexGenerator;
import com.cellml.text.model.ModelNode;
import com.cellml.text.parser.CellmlParser;
import com.cellml.text.parser.ParseResult;
import com.cellml.text.parser.ParserError;
import com.cellml.text.report.LatexDocumentRenderer;
import com.cellml.text.report.ReportRenderException;
import com.cellml.text.xml.CellmlXmlReader;
import com.cellml.text.xml.XmlReadException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CellML Text or XML to LaTeX.
 */
@Command(
        name = "latex",
        mixinStandardHelpOptions = true,
        description = "Renders the equations of a CellML Text or CellML 2.0 XML file as LaTeX."
)
public class LatexCommand extends ConversionCommand {

    @Option(names = { "--document" }, description = "Produce a complete LaTeX document instead of bare equations")
    private boolean document;

    @Override
    protected String convert(String source) {
        ModelNode model = readModel(source);
        LatexGenerator latexGenerator = new LatexGenerator();

        if (document) {
            try {
                return new LatexDocumentRenderer(latexGenerator).render(model);
            } catch (ReportRenderException e) {
                throw new ConversionFailedException(e.getMessage());
            }
        }

        return latexGenerator.convertAll(model).stream()
                .filter(c -> !c.isEmpty())
                .map(LatexCommand::formatComponent)
                .collect(Collectors.joining("\n"));
    }

    private static String formatComponent(ComponentEquations component) {
        StringBuilder sb = new StringBuilder("% ").append(component.getName()).append('\n');
        component.getEquations().forEach(equation -> sb.append(equation).append('\n'));
        return sb.toString();
    }

    // XML documents start with '<'; anything else is CellML Text
    private static ModelNode readModel(String source) {
        if (source.stripLeading().startsWith("<")) {
            try {
                return new CellmlXmlReader().read(source);
            } catch (XmlReadException e) {
                throw new ConversionFailedException(e.getMessage());
            }
        }

        ParseResult result = new CellmlParser().parse(source);
        if (!result.isSuccess()) {
            throw new ConversionFailedException(result.getErrors().stream().map(ParserError::toString).toList());
        }
        return result.getModel();
    }
}
