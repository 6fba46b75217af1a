package com.codeshift.translator.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * An expression statement, kept as its verbatim source text.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ExpressionStatement extends SyntaxNode {
    private String text;

    @Builder
    public ExpressionStatement(int line, String text) {
        this.line = line;
        this.text = text;
    }

    public static ExpressionStatement of(String text) {
        return new ExpressionStatement(0, text);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }
}
