package com.screenir.compiler.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility for consistent identifier naming derived from design layer names.
 */
public class NamingUtil {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    /**
     * Auto-generated or meaningless layer names.
     */
    private static final Pattern GENERIC_NAME = Pattern.compile(
            "^(frame|group|rectangle|ellipse|vector|star|line|polygon|boolean( operation)?|union|subtract|intersect|exclude"
                    + "|layer|component|instance|text|image|container|auto layout)(\\s*\\d+)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> RESERVED = Set.of(
            "abstract", "boolean", "break", "case", "catch", "class", "const", "continue", "default",
            "do", "else", "enum", "export", "extends", "false", "final", "for", "function", "if",
            "import", "in", "instanceof", "interface", "new", "null", "package", "private",
            "protected", "public", "return", "static", "super", "switch", "this", "throw", "true",
            "try", "typeof", "var", "void", "while");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts "product card", "product-card" or "productCard" to PascalCase. Inner
     * capitals are kept, so "HTMLView" stays as is.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return Arrays.stream(WORD_SEPARATOR.split(name.trim()))
                .filter(part -> !part.isEmpty())
                .flatMap(part -> Arrays.stream(CAMEL_BOUNDARY.split(part)))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * camelCase identifier that never starts with a digit and never collides with a
     * reserved word. Returns an empty string when the name has no usable characters.
     */
    public static String toValidIdentifier(String name) {
        String camel = toCamelCase(name);
        if (camel.isEmpty()) {
            return camel;
        }
        if (Character.isDigit(camel.charAt(0))) {
            camel = "_" + camel;
        }
        if (RESERVED.contains(camel)) {
            camel = camel + "Value";
        }
        return camel;
    }

    /**
     * True for names the design tool assigns automatically ("Frame 12", "Group").
     */
    public static boolean isGenericName(String name) {
        return name == null || name.isBlank() || GENERIC_NAME.matcher(name.trim()).matches();
    }

    /**
     * Deterministic short hash: 32-bit string hash, base 36, first four characters.
     */
    public static String shortHash(String value) {
        int hash = 0;
        for (int i = 0; i < value.length(); i++) {
            hash = 31 * hash + value.charAt(i);
        }
        String encoded = Long.toString(Math.abs((long) hash), 36);
        return encoded.length() > 4 ? encoded.substring(0, 4) : encoded;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
