package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A {@code get} or {@code set} accessor of a property. A null body marks an auto accessor.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class AccessorDeclaration extends SyntaxNode {
    private AccessorKind keyword;
    private List<Modifier> modifiers = new ArrayList<>();
    private Block body;

    @Builder
    public AccessorDeclaration(int line, AccessorKind keyword, @Singular List<Modifier> modifiers, Block body) {
        this.line = line;
        this.keyword = keyword;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ACCESSOR;
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isGetter() {
        return keyword == AccessorKind.GET;
    }
}
