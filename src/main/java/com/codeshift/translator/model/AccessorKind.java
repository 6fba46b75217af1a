package com.codeshift.translator.model;

/**
 * Accessor keyword of a property.
 */
public enum AccessorKind {
    GET,
    SET
}
