package com.codeshift.translator.cli.output;

import java.io.PrintWriter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeshift.translator.cli.model.TranslateOptions;
import com.codeshift.translator.cli.model.ValidatedTranslateOptions;
import com.codeshift.translator.codegen.TranslationResult;
import com.codeshift.translator.codegen.TranslationStats;

/**
 * Responsible only for printing CLI output for the "translate" command.
 * No validation, no execution.
 */
public class TranslateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TranslateResultsPrinter.class);

    private final PrintWriter out;

    public TranslateResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printBanner(TranslateOptions o, ValidatedTranslateOptions v) {
        log.info("=================================================");
        log.info("Syntax Tree Translator");
        log.info("=================================================");
        log.info("Syntax Tree: {}", v.getInputFile());
        log.info("Output File: {}", o.isDryRun() ? "None (dry run)" : v.getOutputFile());
        log.info("Indent: {} spaces", o.getIndentWidth());
        log.info("Line Separator: {}", o.getLineEnding());
        log.info("=================================================");
    }

    public void printSuccess(TranslationResult result) {
        TranslationStats stats = result.getStats();

        log.info("");
        log.info("=================================================");
        log.info("TRANSLATION SUCCESSFUL");
        log.info("=================================================");
        if (result.isWritten()) {
            log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        }
        if (stats != null) {
            log.info("Namespaces: {}", stats.getNamespaceCount());
            log.info("Classes: {}", stats.getClassCount());
            log.info("Fields: {}", stats.getFieldCount());
            log.info("Properties: {}", stats.getPropertyCount());
            log.info("Methods: {}", stats.getMethodCount());
            log.info("Statements: {}", stats.getStatementCount());
            log.info("Lines Emitted: {}", stats.getLineCount());
            log.info("Elapsed: {} ms", stats.getTranslationTimeMillis());
        }
        log.info("=================================================");
    }

    /**
     * Writes the translated lines themselves, used for dry runs.
     */
    public void printLines(List<String> lines) {
        for (String line : lines) {
            out.println(line);
        }
        out.flush();
    }

    public void printFailure(TranslationResult result) {
        log.error("Translation failed: {}", result.getErrorMessage());
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }
}
