package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * Root of one source file: the top-level namespaces and types in source order.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class CompilationUnit extends SyntaxNode {
    private List<SyntaxNode> members = new ArrayList<>();

    @Builder
    public CompilationUnit(int line, @Singular List<SyntaxNode> members) {
        this.line = line;
        this.members = members != null ? members : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPILATION_UNIT;
    }
}
