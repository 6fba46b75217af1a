package com.codeshift.translator;

import com.codeshift.translator.cli.TranslateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the syntax tree translator.
 * Reads a syntax tree document produced by an external parser and writes the translated source.
 */
public class TranslatorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TranslateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
