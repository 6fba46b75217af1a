package com.codeshift.translator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One identifier of a field or local declaration, with its optional initializer expression.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableDeclarator {
    private String identifier;
    /** Initializer value as source text, without the leading {@code =}. */
    private String initializer;

    public static VariableDeclarator of(String identifier) {
        return new VariableDeclarator(identifier, null);
    }

    public static VariableDeclarator of(String identifier, String initializer) {
        return new VariableDeclarator(identifier, initializer);
    }

    public boolean hasInitializer() {
        return initializer != null && !initializer.isBlank();
    }
}
