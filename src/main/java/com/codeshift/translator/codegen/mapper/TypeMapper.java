package com.codeshift.translator.codegen.mapper;

import java.util.Collection;

import com.codeshift.translator.model.Modifier;
import com.codeshift.translator.model.TypeReference;

import lombok.experimental.UtilityClass;

/**
 * Maps source type references and modifier lists to their output-language spelling.
 *
 * The type system is deliberately coarse: void, numeric and string, with exception types passed
 * through unchanged. Visibility collapses to public or private; every other modifier is dropped.
 */
@UtilityClass
public class TypeMapper {

    public static final String VOID_TYPE = "void";
    public static final String NUMBER_TYPE = "number";
    public static final String STRING_TYPE = "string";

    public static final String PUBLIC = "public";
    public static final String PRIVATE = "private";

    public String mapType(TypeReference type) {
        return mapType(type != null ? type.getText() : null);
    }

    /**
     * Never fails: a null or empty type falls through to the string bucket. Surrounding
     * whitespace is trimmed before the rules are matched, so {@code " int"} maps to number.
     */
    public String mapType(String sourceType) {
        String text = sourceType != null ? sourceType.trim() : "";
        return ruleFor(text).apply(text);
    }

    public TypeMappingRule ruleFor(String sourceType) {
        String text = sourceType != null ? sourceType : "";
        for (TypeMappingRule rule : TypeMappingRule.values()) {
            if (rule.matches(text)) {
                return rule;
            }
        }
        return TypeMappingRule.STRING_FALLBACK;
    }

    public String mapVisibility(Collection<Modifier> modifiers) {
        if (modifiers != null && modifiers.contains(Modifier.PUBLIC)) {
            return PUBLIC;
        }
        return PRIVATE;
    }
}
