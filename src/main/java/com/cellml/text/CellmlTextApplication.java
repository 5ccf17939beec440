package com.cellml.text;

import com.cellml.text.cli.CellmlTextCommand;
import picocli.CommandLine;

/**
 * Main entry point for the CellML Text compiler.
 * Compiles CellML Text to CellML 2.0 XML and renders models back as text or LaTeX.
 */
public class CellmlTextApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CellmlTextCommand()).execute(args);
        System.exit(exitCode);
    }
}
