package com.codeshift.translator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeshift.translator.cli.exception.OptionsValidationException;
import com.codeshift.translator.cli.model.TranslateOptions;
import com.codeshift.translator.cli.model.ValidatedTranslateOptions;
import com.codeshift.translator.cli.output.TranslateResultsPrinter;
import com.codeshift.translator.cli.validation.TranslateOptionsValidator;
import com.codeshift.translator.codegen.TranslationResult;
import com.codeshift.translator.codegen.TranslationService;
import com.codeshift.translator.codegen.TranslatorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command translating a syntax tree document into target-language source text.
 */
@Command(
        name = "translate",
        mixinStandardHelpOptions = true,
        version = "syntax-tree-translator 1.0.0",
        description = "Translates a parsed syntax tree (JSON) into module/class source text."
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    @Mixin
    private TranslateOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        TranslateResultsPrinter printer = new TranslateResultsPrinter(spec.commandLine().getOut());

        ValidatedTranslateOptions validated;
        try {
            validated = new TranslateOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        }

        printer.printBanner(options, validated);

        TranslatorConfig config = TranslatorConfig.builder()
                .inputFile(validated.getInputFile())
                .outputFile(validated.getOutputFile())
                .indentWidth(options.getIndentWidth())
                .lineSeparator(validated.getLineSeparator())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .build();

        TranslationResult result = new TranslationService(config).translate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        if (options.isDryRun()) {
            printer.printLines(result.getLines());
        }
        printer.printSuccess(result);
        log.debug("Translation finished for {}", validated.getInputFile());
        return 0;
    }
}
