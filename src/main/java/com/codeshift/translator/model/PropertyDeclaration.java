package com.codeshift.translator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A property with its accessor list.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class PropertyDeclaration extends SyntaxNode {
    private String name;
    private List<Modifier> modifiers = new ArrayList<>();
    private TypeReference type;
    private List<AccessorDeclaration> accessors = new ArrayList<>();

    @Builder
    public PropertyDeclaration(int line, String name, @Singular List<Modifier> modifiers, TypeReference type,
                               @Singular List<AccessorDeclaration> accessors) {
        this.line = line;
        this.name = name;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
        this.type = type;
        this.accessors = accessors != null ? accessors : new ArrayList<>();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROPERTY;
    }

    @Override
    protected String label() {
        return name;
    }

    /**
     * True when no accessor has a body ({@code { get; set; }}).
     */
    public boolean isAutoProperty() {
        return accessors.stream().noneMatch(AccessorDeclaration::hasBody);
    }
}
