package com.codeshift.translator.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TranslateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTranslateOptions {
    Path inputFile;
    Path outputFile;
    String lineSeparator;
}
