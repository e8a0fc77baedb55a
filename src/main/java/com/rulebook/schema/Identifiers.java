package com.rulebook.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name conversions between rulebook field names and target-language identifiers.
 */
public final class Identifiers {

    private static final Pattern WORD_BOUNDARY = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern CASE_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield", "sealed", "permits", "_"
    );

    /**
     * Parameter name for a field whose name has no ASCII letters or digits.
     */
    private static final String FALLBACK_PARAMETER = "field";

    private Identifiers() {
    }

    /**
     * Convert to snake_case: {@code ResolvesToAnAST} becomes {@code resolves_to_an_ast}.
     */
    public static String toSnakeCase(String name) {
        String s = SEPARATORS.matcher(name.trim()).replaceAll("_");
        s = WORD_BOUNDARY.matcher(s).replaceAll("$1_$2");
        s = CASE_BOUNDARY.matcher(s).replaceAll("$1_$2");
        return s.replaceAll("_+", "_").toLowerCase(Locale.ROOT);
    }

    /**
     * Convert to PascalCase, keeping existing inner capitals: {@code has_syntax} and
     * {@code HasSyntax} both become {@code HasSyntax}.
     */
    public static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String word : words(name)) {
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        if (sb.length() == 0 || !Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * Convert to camelCase: {@code HasSyntax} becomes {@code hasSyntax}.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal.startsWith("_")) {
            return pascal;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /**
     * camelCase name that is a legal Java parameter name.
     */
    public static String toJavaParameter(String name) {
        String camel = toCamelCase(name);
        if (camel.equals("_")) {
            return FALLBACK_PARAMETER;
        }
        return JAVA_KEYWORDS.contains(camel) ? camel + "_" : camel;
    }

    private static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        for (String part : SEPARATORS.split(name.trim())) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return words;
    }
}
