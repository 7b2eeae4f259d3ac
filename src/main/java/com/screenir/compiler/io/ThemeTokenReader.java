package com.screenir.compiler.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.mapping.ProjectTokens;
import com.screenir.compiler.mapping.TypographyKey;
import com.screenir.compiler.util.Numbers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flattens a JSON theme object into {@link ProjectTokens}. Token paths start at
 * {@code theme}, e.g. {@code theme.colors.primary}.
 *
 * <ul>
 *   <li>{@code #RRGGBB} / {@code #RRGGBBAA} strings are colors</li>
 *   <li>numbers under a spacing, gap, margin or padding path are spacing</li>
 *   <li>numbers under a radius or radii path are radii</li>
 *   <li>objects with an x offset and a blur are shadows</li>
 *   <li>objects with fontFamily and fontSize are typography</li>
 * </ul>
 * Anything else is skipped. When two paths carry the same value the first one wins.
 */
public class ThemeTokenReader {

    private static final Logger log = LoggerFactory.getLogger(ThemeTokenReader.class);

    static final String ROOT_PATH = "theme";

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}([0-9A-Fa-f]{2})?$");

    private final ObjectMapper objectMapper;

    public ThemeTokenReader() {
        this(new ObjectMapper());
    }

    public ThemeTokenReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectTokens read(Path file) {
        log.debug("Reading theme tokens {}", file);
        try {
            return fromJson(objectMapper.readTree(Files.readString(file)));
        } catch (JsonProcessingException e) {
            throw new DesignDocumentException("Malformed theme file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DesignDocumentException("Cannot read theme file " + file, e);
        }
    }

    public ProjectTokens parse(String json) {
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DesignDocumentException("Malformed theme: " + e.getOriginalMessage(), e);
        }
    }

    ProjectTokens fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new DesignDocumentException("Theme must be a JSON object");
        }
        JsonNode theme = json.size() == 1 && json.path(ROOT_PATH).isObject() ? json.get(ROOT_PATH) : json;

        Collected collected = new Collected();
        walk(theme, ROOT_PATH, collected);

        ProjectTokens tokens = ProjectTokens.builder()
                .colors(collected.colors)
                .spacing(collected.spacing)
                .radii(collected.radii)
                .typography(collected.typography)
                .shadows(collected.shadows)
                .build();
        log.debug("Theme provides {} token(s)", tokens.size());
        return tokens;
    }

    private void walk(JsonNode node, String path, Collected collected) {
        if (node.isObject()) {
            if (isShadow(node)) {
                collected.shadows.putIfAbsent(shadowKey(node), path);
                return;
            }
            if (isTypography(node)) {
                collected.typography.putIfAbsent(typographyKey(node), path);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                walk(field.getValue(), path + "." + field.getKey(), collected);
            }
            return;
        }

        if (node.isTextual() && HEX_COLOR.matcher(node.asText()).matches()) {
            collected.colors.putIfAbsent(node.asText().toUpperCase(Locale.ROOT), path);
        } else if (node.isNumber()) {
            String lowerPath = path.toLowerCase(Locale.ROOT);
            if (lowerPath.contains("spacing") || lowerPath.contains("gap")
                    || lowerPath.contains("margin") || lowerPath.contains("padding")) {
                collected.spacing.putIfAbsent(node.asDouble(), path);
            } else if (lowerPath.contains("radius") || lowerPath.contains("radii")) {
                collected.radii.putIfAbsent(node.asDouble(), path);
            } else {
                log.trace("Skipping ambiguous numeric value at {}", path);
            }
        }
    }

    private static boolean isShadow(JsonNode node) {
        return (node.has("offsetX") || node.has("x")) && (node.has("blur") || node.has("radius"));
    }

    private static boolean isTypography(JsonNode node) {
        return node.path("fontFamily").isTextual() && node.path("fontSize").isNumber();
    }

    private static String shadowKey(JsonNode node) {
        double x = node.has("offsetX") ? node.path("offsetX").asDouble(0) : node.path("x").asDouble(0);
        double y = node.has("offsetY") ? node.path("offsetY").asDouble(0) : node.path("y").asDouble(0);
        double blur = node.has("blur") ? node.path("blur").asDouble(0) : node.path("radius").asDouble(0);
        double spread = node.path("spread").asDouble(0);
        return Numbers.format(x) + "," + Numbers.format(y) + "," + Numbers.format(blur) + "," + Numbers.format(spread);
    }

    private static String typographyKey(JsonNode node) {
        double size = node.get("fontSize").asDouble();
        double lineHeight = node.path("lineHeight").isNumber() ? node.get("lineHeight").asDouble() : size * 1.2;
        return TypographyKey.of(node.get("fontFamily").asText(), size, fontWeight(node.path("fontWeight")), lineHeight)
                .toString();
    }

    private static double fontWeight(JsonNode weight) {
        if (weight.isNumber()) {
            return weight.asDouble();
        }
        String text = weight.asText("").trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "bold" -> 700;
            case "semibold" -> 600;
            case "medium" -> 500;
            case "light" -> 300;
            case "", "normal", "regular" -> 400;
            default -> {
                try {
                    yield Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    log.warn("Unrecognized font weight '{}', using 400", text);
                    yield 400;
                }
            }
        };
    }

    private static final class Collected {
        final Map<String, String> colors = new LinkedHashMap<>();
        final Map<Double, String> spacing = new LinkedHashMap<>();
        final Map<Double, String> radii = new LinkedHashMap<>();
        final Map<String, String> typography = new LinkedHashMap<>();
        final Map<String, String> shadows = new LinkedHashMap<>();
    }
}
