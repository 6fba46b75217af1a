package com.codeshift.translator.codegen.mapper;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Ordered type mapping rules. Declaration order is evaluation order and the first match wins;
 * the last rule matches everything so the mapping is total.
 */
public enum TypeMappingRule {

    VOID(source -> TypeMapper.VOID_TYPE.equals(source), source -> TypeMapper.VOID_TYPE),

    /** Exception types are assumed to exist under the same name in the target language. */
    EXCEPTION_PASSTHROUGH(source -> source.endsWith("Exception"), UnaryOperator.identity()),

    NUMERIC(source -> source.startsWith("int"), source -> TypeMapper.NUMBER_TYPE),

    STRING_FALLBACK(source -> true, source -> TypeMapper.STRING_TYPE);

    private final Predicate<String> matcher;
    private final UnaryOperator<String> mapping;

    TypeMappingRule(Predicate<String> matcher, UnaryOperator<String> mapping) {
        this.matcher = matcher;
        this.mapping = mapping;
    }

    public boolean matches(String sourceType) {
        return matcher.test(sourceType);
    }

    public String apply(String sourceType) {
        return mapping.apply(sourceType);
    }
}
