package org.carball.ckmetrics.language;

import java.util.Set;

/**
 * Normalisation and filtering of type names read from source text.
 */
public final class TypeNames {

    private static final Set<String> PRIMITIVES = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64",
            "float", "float32", "float64", "double",
            "bool", "boolean", "Boolean",
            "string", "String", "str",
            "void", "None", "null", "nil",
            "byte", "char", "short", "long",
            "any", "object", "Object",
            "number", "Number",
            "true", "false",
            "self", "this", "super"
    );

    private TypeNames() {
    }

    /**
     * Strips generic or template arguments ({@code List<String>} becomes {@code List},
     * {@code Foo[T]} becomes {@code Foo}) and surrounding whitespace.
     */
    public static String clean(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = name;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c == '<' || c == '[') {
                cleaned = cleaned.substring(0, i);
                break;
            }
        }
        return cleaned.strip();
    }

    public static boolean isPrimitive(String name) {
        return PRIMITIVES.contains(name);
    }
}
