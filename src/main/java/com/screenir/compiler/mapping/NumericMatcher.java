package com.screenir.compiler.mapping;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tolerance matching of spacing and radius values against project tokens: exact
 * value first, else the nearest value within {@code max(minTolerance, value * ratio)}.
 */
public class NumericMatcher {

    static final double MIN_TOLERANCE = 2;
    static final double SPACING_RATIO = 0.20;
    static final double RADIUS_RATIO = 0.15;
    static final double PILL_RADIUS = 30;

    public Optional<String> matchSpacing(double value, Map<Double, String> projectSpacing) {
        return matchWithin(value, projectSpacing, SPACING_RATIO);
    }

    /**
     * Radii of {@value #PILL_RADIUS} or more are pills or circles: a token named
     * {@code full} or {@code round} at least that large is preferred, then the nearest token that is
     * itself at least that large.
     */
    public Optional<String> matchRadius(double value, Map<Double, String> projectRadii) {
        String exact = projectRadii.get(value);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (value >= PILL_RADIUS) {
            Optional<String> named = projectRadii.entrySet().stream()
                    .filter(entry -> entry.getKey() >= PILL_RADIUS && isRoundName(entry.getValue()))
                    .map(Map.Entry::getValue)
                    .min(TokenPaths.SIMPLEST_FIRST);
            if (named.isPresent()) {
                return named;
            }
            Optional<String> large = nearest(value, projectRadii, Double.MAX_VALUE, PILL_RADIUS);
            if (large.isPresent()) {
                return large;
            }
        }
        return matchWithin(value, projectRadii, RADIUS_RATIO);
    }

    private static Optional<String> matchWithin(double value, Map<Double, String> tokens, double ratio) {
        String exact = tokens.get(value);
        if (exact != null) {
            return Optional.of(exact);
        }
        double tolerance = Math.max(MIN_TOLERANCE, Math.abs(value) * ratio);
        return nearest(value, tokens, tolerance, -Double.MAX_VALUE);
    }

    private static Optional<String> nearest(double value, Map<Double, String> tokens, double tolerance,
                                            double minTokenValue) {
        String bestPath = null;
        double bestDistance = Double.MAX_VALUE;
        for (Map.Entry<Double, String> entry : tokens.entrySet()) {
            if (entry.getKey() < minTokenValue) {
                continue;
            }
            double distance = Math.abs(entry.getKey() - value);
            if (distance > tolerance) {
                continue;
            }
            if (distance < bestDistance
                    || (distance == bestDistance && TokenPaths.SIMPLEST_FIRST.compare(entry.getValue(), bestPath) < 0)) {
                bestDistance = distance;
                bestPath = entry.getValue();
            }
        }
        return Optional.ofNullable(bestPath);
    }

    private static boolean isRoundName(String path) {
        String name = TokenPaths.lastSegment(path).toLowerCase(Locale.ROOT);
        return name.contains("full") || name.contains("round");
    }
}
