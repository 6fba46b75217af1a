package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * An ordered statement list. Brackets belong to the construct owning the block.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Block extends SyntaxNode {
    private List<SyntaxNode> statements = new ArrayList<>();

    @Builder
    public Block(int line, @Singular List<SyntaxNode> statements) {
        this.line = line;
        this.statements = statements != null ? statements : new ArrayList<>();
    }

    public static Block of(SyntaxNode... statements) {
        return new Block(0, new ArrayList<>(List.of(statements)));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK;
    }
}
