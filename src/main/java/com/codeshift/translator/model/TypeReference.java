package com.codeshift.translator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Value;

/**
 * Textual type expression attached to a field, property, parameter, return position or local.
 */
@Value
public class TypeReference {

    public static final String INFERRED = "var";

    @JsonValue
    String text;

    /**
     * Stores {@code text} trimmed; null becomes the empty string.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TypeReference of(String text) {
        return new TypeReference(text == null ? "" : text.trim());
    }

    public static TypeReference inferred() {
        return new TypeReference(INFERRED);
    }

    /**
     * True for the placeholder used when the local's type is left to inference.
     */
    public boolean isInferred() {
        return INFERRED.equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
