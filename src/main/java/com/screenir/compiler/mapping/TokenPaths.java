package com.screenir.compiler.mapping;

import java.util.Comparator;

/**
 * Orders project token paths by simplicity: fewer segments, then shorter, then
 * lexically.
 */
final class TokenPaths {

    static final Comparator<String> SIMPLEST_FIRST = Comparator
            .comparingInt(TokenPaths::depth)
            .thenComparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    private TokenPaths() {
    }

    static int depth(String path) {
        int dots = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '.') {
                dots++;
            }
        }
        return dots;
    }

    /**
     * True when {@code path} is {@code suffix} or ends with {@code .suffix}.
     */
    static boolean endsWithSegments(String path, String suffix) {
        return path.equals(suffix) || path.endsWith("." + suffix);
    }

    static String lastSegment(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
