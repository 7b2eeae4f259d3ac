package com.screenir.compiler.mapping;

import lombok.Value;

import java.util.Map;

/**
 * Per category, each source value mapped to a project token path, or to itself when
 * nothing matched.
 */
@Value
public class TokenMappings {
    Map<String, String> colors;
    Map<String, String> spacing;
    Map<String, String> radii;
    Map<String, String> typography;
    Map<String, String> shadows;

    public static TokenMappings empty() {
        return new TokenMappings(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Number of source values that resolved to a project token.
     */
    public int matchedCount() {
        return matched(colors) + matched(spacing) + matched(radii) + matched(typography) + matched(shadows);
    }

    public int totalCount() {
        return colors.size() + spacing.size() + radii.size() + typography.size() + shadows.size();
    }

    private static int matched(Map<String, String> category) {
        int count = 0;
        for (Map.Entry<String, String> entry : category.entrySet()) {
            if (!entry.getKey().equals(entry.getValue())) {
                count++;
            }
        }
        return count;
    }
}
