package com.codeshift.translator.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A return statement, kept as its verbatim source text.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ReturnStatement extends SyntaxNode {
    private String text;

    @Builder
    public ReturnStatement(int line, String text) {
        this.line = line;
        this.text = text;
    }

    public static ReturnStatement of(String text) {
        return new ReturnStatement(0, text);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RETURN;
    }
}
