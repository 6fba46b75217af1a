package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A class declaration. Base types are not carried: the target output has no use for them.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ClassDeclaration extends SyntaxNode {
    private String name;
    private List<Modifier> modifiers = new ArrayList<>();
    private List<SyntaxNode> members = new ArrayList<>();

    @Builder
    public ClassDeclaration(int line, String name, @Singular List<Modifier> modifiers,
                            @Singular List<SyntaxNode> members) {
        this.line = line;
        this.name = name;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
        this.members = members != null ? members : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS;
    }

    @Override
    protected String label() {
        return name;
    }
}
