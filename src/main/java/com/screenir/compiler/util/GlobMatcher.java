package com.screenir.compiler.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive glob match over layer names. Supports {@code *} and {@code ?}.
 */
public final class GlobMatcher {

    private final String glob;
    private final Pattern pattern;

    private GlobMatcher(String glob) {
        this.glob = glob;
        this.pattern = Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    public static GlobMatcher of(String glob) {
        return new GlobMatcher(glob);
    }

    public boolean matches(String name) {
        return name != null && pattern.matcher(name.toLowerCase(Locale.ROOT)).matches();
    }

    public String getGlob() {
        return glob;
    }

    private static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toLowerCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
