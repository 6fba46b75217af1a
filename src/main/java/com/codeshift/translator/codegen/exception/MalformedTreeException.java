package com.codeshift.translator.codegen.exception;

import com.codeshift.translator.model.SyntaxNode;

/**
 * Thrown when a node lacks an attribute its kind requires. The translation is aborted; no
 * partial output is produced.
 */
public class MalformedTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedTreeException(String message) {
        super(message);
    }

    public static MalformedTreeException missing(SyntaxNode node, String attribute) {
        return new MalformedTreeException(node.describe() + " is missing its " + attribute);
    }
}
