package com.codeshift.translator.model;

/**
 * Tag distinguishing the declaration and statement categories of the syntax tree.
 */
public enum NodeKind {
    COMPILATION_UNIT,
    NAMESPACE,
    CLASS,
    FIELD,
    PROPERTY,
    ACCESSOR,
    METHOD,
    PARAMETER,
    BLOCK,
    TRY,
    CATCH,
    RETURN,
    EXPRESSION_STATEMENT,
    VARIABLE_DECLARATION
}
