package com.codeshift.translator.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for all syntax tree nodes handed over by the external parser.
 *
 * The tree is read-only input: nothing in the translator mutates it.
 */
@Data
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CompilationUnit.class, name = "COMPILATION_UNIT"),
        @JsonSubTypes.Type(value = NamespaceDeclaration.class, name = "NAMESPACE"),
        @JsonSubTypes.Type(value = ClassDeclaration.class, name = "CLASS"),
        @JsonSubTypes.Type(value = FieldDeclaration.class, name = "FIELD"),
        @JsonSubTypes.Type(value = PropertyDeclaration.class, name = "PROPERTY"),
        @JsonSubTypes.Type(value = AccessorDeclaration.class, name = "ACCESSOR"),
        @JsonSubTypes.Type(value = MethodDeclaration.class, name = "METHOD"),
        @JsonSubTypes.Type(value = Parameter.class, name = "PARAMETER"),
        @JsonSubTypes.Type(value = Block.class, name = "BLOCK"),
        @JsonSubTypes.Type(value = TryStatement.class, name = "TRY"),
        @JsonSubTypes.Type(value = CatchClause.class, name = "CATCH"),
        @JsonSubTypes.Type(value = ReturnStatement.class, name = "RETURN"),
        @JsonSubTypes.Type(value = ExpressionStatement.class, name = "EXPRESSION_STATEMENT"),
        @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VARIABLE_DECLARATION")
})
public abstract class SyntaxNode {
    /** 1-based source line, 0 when the parser did not supply one. */
    protected int line;

    public abstract NodeKind getKind();

    /**
     * Short description used in diagnostics, e.g. {@code METHOD 'Add' (line 12)}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getKind().name());
        String label = label();
        if (label != null) {
            sb.append(" '").append(label).append("'");
        }
        if (line > 0) {
            sb.append(" (line ").append(line).append(")");
        }
        return sb.toString();
    }

    protected String label() {
        return null;
    }
}
