package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A local variable declaration binding one or more identifiers.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class VariableDeclaration extends SyntaxNode {
    private TypeReference type;
    private List<VariableDeclarator> variables = new ArrayList<>();

    @Builder
    public VariableDeclaration(int line, TypeReference type, @Singular List<VariableDeclarator> variables) {
        this.line = line;
        this.type = type;
        this.variables = variables != null ? variables : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE_DECLARATION;
    }
}
