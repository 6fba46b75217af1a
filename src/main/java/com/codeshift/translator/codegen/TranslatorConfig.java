package com.codeshift.translator.codegen;

import java.nio.file.Path;

import com.codeshift.translator.codegen.emitter.ScopedEmitter;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one translation run.
 */
@Data
@Builder
public class TranslatorConfig {

    /**
     * JSON syntax tree document to translate.
     */
    private Path inputFile;

    /**
     * Destination of the emitted source text.
     */
    private Path outputFile;

    /**
     * Spaces per nesting level.
     */
    @Builder.Default
    private int indentWidth = ScopedEmitter.DEFAULT_INDENT_WIDTH;

    /**
     * Terminator placed between emitted lines when the output is rendered.
     */
    @Builder.Default
    private String lineSeparator = System.lineSeparator();

    /**
     * Whether an existing output file may be overwritten.
     */
    private boolean force;

    /**
     * Whether this is a dry run (nothing written).
     */
    private boolean dryRun;

    public static TranslatorConfig defaults() {
        return TranslatorConfig.builder().build();
    }
}
