package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A field statement. One statement may declare several identifiers sharing the type.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class FieldDeclaration extends SyntaxNode {
    private List<Modifier> modifiers = new ArrayList<>();
    private TypeReference type;
    private List<VariableDeclarator> variables = new ArrayList<>();

    @Builder
    public FieldDeclaration(int line, @Singular List<Modifier> modifiers, TypeReference type,
                            @Singular List<VariableDeclarator> variables) {
        this.line = line;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
        this.type = type;
        this.variables = variables != null ? variables : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FIELD;
    }
}
