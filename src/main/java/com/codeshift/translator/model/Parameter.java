package com.codeshift.translator.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A method parameter.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Parameter extends SyntaxNode {
    private String name;
    private TypeReference type;

    @Builder
    public Parameter(int line, String name, TypeReference type) {
        this.line = line;
        this.name = name;
        this.type = type;
    }

    public static Parameter of(String name, String type) {
        return new Parameter(0, name, TypeReference.of(type));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARAMETER;
    }

    @Override
    protected String label() {
        return name;
    }
}
