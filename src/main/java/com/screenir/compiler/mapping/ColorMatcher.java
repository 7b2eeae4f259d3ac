package com.screenir.compiler.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches a design color to a project color token.
 *
 * <p>A token equal to the source, alpha included, wins; then an exact RGB match. Otherwise the project color with the smallest
 * CIE76 Delta-E within the threshold is chosen; candidates within {@value #TIE_BAND}
 * of the best distance are ties, broken in favor of the simplest token path. Opaque
 * design colors are only compared with opaque project colors. When nothing is close
 * enough, a luminance-based guess at a text or background token is tried.
 */
public class ColorMatcher {

    private static final Logger log = LoggerFactory.getLogger(ColorMatcher.class);

    public static final double DEFAULT_THRESHOLD = 8;

    static final double TIE_BAND = 0.5;

    static final double VERY_DARK_LUMINANCE = 0.05;
    static final double MEDIUM_DARK_LUMINANCE = 0.2;
    static final double VERY_LIGHT_LUMINANCE = 0.9;

    private static final List<String> DARK_CANDIDATES =
            List.of("colors.text", "textPrimary", "black", "gray900", "dark");
    private static final List<String> LIGHT_CANDIDATES =
            List.of("colors.background", "white", "surface");
    private static final List<String> MEDIUM_DARK_CANDIDATES =
            List.of("colors.textSecondary", "secondaryText", "gray600");

    private final double threshold;

    public ColorMatcher() {
        this(DEFAULT_THRESHOLD);
    }

    public ColorMatcher(double threshold) {
        this.threshold = threshold;
    }

    /**
     * The matched token path, or the source value unchanged.
     */
    public String match(String sourceValue, Map<String, String> projectColors) {
        return findMatch(sourceValue, projectColors).orElse(sourceValue);
    }

    public Optional<String> findMatch(String sourceValue, Map<String, String> projectColors) {
        Optional<HexColor> parsed = HexColor.parse(sourceValue);
        if (parsed.isEmpty()) {
            log.warn("Skipping unparseable design color '{}'", sourceValue);
            return Optional.empty();
        }
        HexColor source = parsed.get();
        Map<String, HexColor> candidates = candidates(source, projectColors);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> identical = identicalMatch(source, candidates);
        if (identical.isPresent()) {
            return identical;
        }
        Optional<String> exact = exactMatch(source, candidates);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<String> closest = closestMatch(source, candidates);
        if (closest.isPresent()) {
            return closest;
        }
        return luminanceFallback(source, candidates);
    }

    /**
     * Parsed project colors eligible for the source, keyed by path. Opaque sources
     * only see opaque tokens.
     */
    private Map<String, HexColor> candidates(HexColor source, Map<String, String> projectColors) {
        Map<String, HexColor> candidates = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : projectColors.entrySet()) {
            Optional<HexColor> color = HexColor.parse(entry.getKey());
            if (color.isEmpty()) {
                log.warn("Skipping unparseable project color '{}' at {}", entry.getKey(), entry.getValue());
                continue;
            }
            if (source.isSolid() && !color.get().isSolid()) {
                continue;
            }
            candidates.putIfAbsent(entry.getValue(), color.get());
        }
        return candidates;
    }

    private static Optional<String> identicalMatch(HexColor source, Map<String, HexColor> candidates) {
        String hex = source.toHex();
        return candidates.entrySet().stream()
                .filter(entry -> entry.getValue().toHex().equals(hex))
                .map(Map.Entry::getKey)
                .min(TokenPaths.SIMPLEST_FIRST);
    }

    private static Optional<String> exactMatch(HexColor source, Map<String, HexColor> candidates) {
        String rgb = source.toRgbHex();
        return candidates.entrySet().stream()
                .filter(entry -> entry.getValue().toRgbHex().equals(rgb))
                .map(Map.Entry::getKey)
                .min(TokenPaths.SIMPLEST_FIRST);
    }

    private Optional<String> closestMatch(HexColor source, Map<String, HexColor> candidates) {
        double[] sourceLab = ColorSpace.toLab(source);
        Map<String, Double> distances = new LinkedHashMap<>();
        double best = Double.MAX_VALUE;
        for (Map.Entry<String, HexColor> entry : candidates.entrySet()) {
            double distance = ColorSpace.deltaE76(sourceLab, ColorSpace.toLab(entry.getValue()));
            if (distance <= threshold) {
                distances.put(entry.getKey(), distance);
                best = Math.min(best, distance);
            }
        }
        if (distances.isEmpty()) {
            return Optional.empty();
        }
        double bestDistance = best;
        List<String> ties = new ArrayList<>();
        distances.forEach((path, distance) -> {
            if (distance - bestDistance <= TIE_BAND) {
                ties.add(path);
            }
        });
        return ties.stream().min(TokenPaths.SIMPLEST_FIRST);
    }

    private static Optional<String> luminanceFallback(HexColor source, Map<String, HexColor> candidates) {
        double luminance = ColorSpace.relativeLuminance(source);
        List<String> semanticNames;
        if (luminance < VERY_DARK_LUMINANCE) {
            semanticNames = DARK_CANDIDATES;
        } else if (luminance > VERY_LIGHT_LUMINANCE) {
            semanticNames = LIGHT_CANDIDATES;
        } else if (luminance <= MEDIUM_DARK_LUMINANCE) {
            semanticNames = MEDIUM_DARK_CANDIDATES;
        } else {
            return Optional.empty();
        }

        for (String name : semanticNames) {
            Optional<String> path = candidates.keySet().stream()
                    .filter(candidate -> TokenPaths.endsWithSegments(candidate, name))
                    .min(TokenPaths.SIMPLEST_FIRST);
            if (path.isPresent()) {
                log.debug("No close color for {}, using semantic fallback {}", source.toRgbHex(), path.get());
                return path;
            }
        }
        return Optional.empty();
    }
}
