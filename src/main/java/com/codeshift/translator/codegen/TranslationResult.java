package com.codeshift.translator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a translation run.
 */
@Data
@Builder
public class TranslationResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private boolean written;

    @Singular
    private List<String> lines;
    private TranslationStats stats;

    public static TranslationResult failure(String errorMessage) {
        return TranslationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
