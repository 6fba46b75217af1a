package com.codeshift.translator.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Keyword tokens that may be attached to a declaration.
 *
 * Only {@link #PUBLIC} drives output. Keywords without a constant of their own resolve to
 * {@link #UNKNOWN} so that newer or rarer source modifiers never reject a tree.
 */
public enum Modifier {
    PUBLIC,
    PRIVATE,
    PROTECTED,
    INTERNAL,
    FILE,
    STATIC,
    ABSTRACT,
    VIRTUAL,
    OVERRIDE,
    SEALED,
    NEW,
    READONLY,
    CONST,
    VOLATILE,
    EXTERN,
    UNSAFE,
    FIXED,
    REQUIRED,
    PARTIAL,
    ASYNC,
    UNKNOWN;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a keyword as written in source ({@code "public"}) or as the constant name.
     * Unlisted keywords map to {@link #UNKNOWN}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Modifier fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Modifier keyword must not be blank");
        }
        String name = keyword.trim().toUpperCase(Locale.ROOT);
        for (Modifier modifier : values()) {
            if (modifier.name().equals(name)) {
                return modifier;
            }
        }
        return UNKNOWN;
    }
}
