package com.screenir.compiler.mapping;

import com.screenir.compiler.styles.DesignTokens;
import com.screenir.compiler.styles.ShadowStyle;
import com.screenir.compiler.styles.TypographyToken;
import com.screenir.compiler.util.Numbers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a document's design tokens onto a project's token table. Pure: the result
 * depends only on the two inputs and the color threshold.
 */
public class TokenMatcher {

    private static final Logger log = LoggerFactory.getLogger(TokenMatcher.class);

    private final NumericMatcher numericMatcher = new NumericMatcher();

    public TokenMappings matchTokens(DesignTokens tokens, ProjectTokens project) {
        return matchTokens(tokens, project, ColorMatcher.DEFAULT_THRESHOLD);
    }

    public TokenMappings matchTokens(DesignTokens tokens, ProjectTokens project, double colorThreshold) {
        ProjectTokens table = project != null ? project : ProjectTokens.empty();
        ColorMatcher colorMatcher = new ColorMatcher(colorThreshold);

        Map<String, String> colors = new LinkedHashMap<>();
        for (String hex : tokens.getColors().values()) {
            colors.putIfAbsent(hex, colorMatcher.match(hex, table.getColors()));
        }

        Map<String, String> spacing = new LinkedHashMap<>();
        for (Double value : tokens.getSpacing().values()) {
            String literal = Numbers.format(value);
            spacing.putIfAbsent(literal, numericMatcher.matchSpacing(value, table.getSpacing()).orElse(literal));
        }

        Map<String, String> radii = new LinkedHashMap<>();
        for (Double value : tokens.getRadii().values()) {
            String literal = Numbers.format(value);
            radii.putIfAbsent(literal, numericMatcher.matchRadius(value, table.getRadii()).orElse(literal));
        }

        Map<String, String> typography = new LinkedHashMap<>();
        for (TypographyToken token : tokens.getTypography().values()) {
            TypographyKey key = TypographyKey.of(token);
            typography.putIfAbsent(key.toString(), matchTypography(key, table.getTypography()).orElse(key.toString()));
        }

        Map<String, String> shadows = new LinkedHashMap<>();
        for (ShadowStyle shadow : tokens.getShadows().values()) {
            String key = shadow.geometryKey();
            shadows.putIfAbsent(key, table.getShadows().getOrDefault(key, key));
        }

        TokenMappings mappings = new TokenMappings(
                Collections.unmodifiableMap(colors),
                Collections.unmodifiableMap(spacing),
                Collections.unmodifiableMap(radii),
                Collections.unmodifiableMap(typography),
                Collections.unmodifiableMap(shadows));
        log.debug("Matched {} of {} token value(s)", mappings.matchedCount(), mappings.totalCount());
        return mappings;
    }

    /**
     * Exact composite key first, then the closest key within the fuzzy window.
     */
    Optional<String> matchTypography(TypographyKey key, Map<String, String> projectTypography) {
        String exact = projectTypography.get(key.toString());
        if (exact != null) {
            return Optional.of(exact);
        }
        String bestPath = null;
        double bestDistance = Double.MAX_VALUE;
        for (Map.Entry<String, String> entry : projectTypography.entrySet()) {
            Optional<TypographyKey> candidate = TypographyKey.parse(entry.getKey());
            if (candidate.isEmpty()) {
                log.warn("Skipping malformed typography key '{}' at {}", entry.getKey(), entry.getValue());
                continue;
            }
            if (candidate.get().equals(key)) {
                return Optional.of(entry.getValue());
            }
            if (!key.isCloseTo(candidate.get())) {
                continue;
            }
            double distance = key.distanceTo(candidate.get());
            if (distance < bestDistance
                    || (distance == bestDistance && TokenPaths.SIMPLEST_FIRST.compare(entry.getValue(), bestPath) < 0)) {
                bestDistance = distance;
                bestPath = entry.getValue();
            }
        }
        return Optional.ofNullable(bestPath);
    }
}
