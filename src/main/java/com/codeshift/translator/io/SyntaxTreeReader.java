package com.codeshift.translator.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.codeshift.translator.model.SyntaxNode;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads syntax tree documents produced by the external parser.
 *
 * <p>Each JSON object names its node type in a {@code kind} property ({@code "CLASS"},
 * {@code "METHOD"}, ...); the remaining properties match the node's attributes. An explicit
 * {@code null} for a list attribute reads as an empty list.</p>
 */
public final class SyntaxTreeReader {

    private static final ObjectMapper MAPPER = createMapper();

    private SyntaxTreeReader() {}

    public static SyntaxNode read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, SyntaxNode.class);
        }
    }

    /** Parse a syntax tree from a JSON string. */
    public static SyntaxNode readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, SyntaxNode.class);
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .withConfigOverride(List.class,
                        override -> override.setSetterInfo(JsonSetter.Value.forValueNulls(Nulls.AS_EMPTY)))
                .build();
    }
}
