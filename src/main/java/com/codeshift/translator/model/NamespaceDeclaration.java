package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A namespace and the declarations nested in it.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class NamespaceDeclaration extends SyntaxNode {
    private String name;
    private List<SyntaxNode> members = new ArrayList<>();

    @Builder
    public NamespaceDeclaration(int line, String name, @Singular List<SyntaxNode> members) {
        this.line = line;
        this.name = name;
        this.members = members != null ? members : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAMESPACE;
    }

    @Override
    protected String label() {
        return name;
    }
}
