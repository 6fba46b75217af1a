package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A try block followed by its catch clauses in source order.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class TryStatement extends SyntaxNode {
    private Block block;
    private List<CatchClause> catches = new ArrayList<>();

    @Builder
    public TryStatement(int line, Block block, @Singular("catchClause") List<CatchClause> catches) {
        this.line = line;
        this.block = block;
        this.catches = catches != null ? catches : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY;
    }
}
