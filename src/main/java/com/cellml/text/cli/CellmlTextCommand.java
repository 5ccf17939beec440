package com.cellml.text.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; the work is done by its subcommands.
 */
@Command(
        name = "cellml-text",
        mixinStandardHelpOptions = true,
        version = "cellml-text-compiler 1.0.0",
        description = "Converts between CellML Text, CellML 2.0 XML and LaTeX.",
        subcommands = { XmlCommand.class, TextCommand.class, LatexCommand.class }
)
public class CellmlTextCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CellmlTextCommand.class);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        log.error("A subcommand is required: xml, text or latex");
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }
}
