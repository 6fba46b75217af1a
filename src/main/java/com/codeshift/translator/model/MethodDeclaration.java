package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A method with its parameter list and body block.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class MethodDeclaration extends SyntaxNode {
    private String name;
    private List<Modifier> modifiers = new ArrayList<>();
    private TypeReference returnType;
    private List<Parameter> parameters = new ArrayList<>();
    private Block body;

    @Builder
    public MethodDeclaration(int line, String name, @Singular List<Modifier> modifiers, TypeReference returnType,
                             @Singular List<Parameter> parameters, Block body) {
        this.line = line;
        this.name = name;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
        this.returnType = returnType;
        this.parameters = parameters != null ? parameters : new ArrayList<>();
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.METHOD;
    }

    @Override
    protected String label() {
        return name;
    }
}
