package com.codeshift.translator.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * One catch clause. The caught type is kept for completeness but never emitted.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class CatchClause extends SyntaxNode {
    private TypeReference exceptionType;
    private String identifier;
    private Block block;

    @Builder
    public CatchClause(int line, TypeReference exceptionType, String identifier, Block block) {
        this.line = line;
        this.exceptionType = exceptionType;
        this.identifier = identifier;
        this.block = block;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CATCH;
    }

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isBlank();
    }
}
