package com.codeshift.translator.codegen;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a translation run.
 */
@Value
@Builder(toBuilder = true)
public class TranslationStats {

    int namespaceCount;
    int classCount;
    int fieldCount;
    int propertyCount;
    int methodCount;
    int statementCount;
    int lineCount;

    long translationTimeMillis;
}
