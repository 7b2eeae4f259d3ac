package com.screenir.compiler.mapping;

import com.screenir.compiler.styles.TypographyToken;
import com.screenir.compiler.util.Numbers;

import lombok.Value;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Composite typography key {@code family:size:weight:lineHeight}, with the weight
 * rounded to the nearest hundred and the line height rounded to a whole pixel.
 */
@Value
public class TypographyKey {

    static final double SIZE_TOLERANCE = 1;
    static final double LINE_HEIGHT_TOLERANCE = 2;

    String family;
    double size;
    int weight;
    long lineHeight;

    public static TypographyKey of(String family, double size, double weight, double lineHeight) {
        return new TypographyKey(family, size, (int) Math.round(weight / 100.0) * 100, Math.round(lineHeight));
    }

    public static TypographyKey of(TypographyToken token) {
        return of(token.getFontFamily(), token.getFontSize(), token.getFontWeight(), token.getLineHeight());
    }

    /**
     * Parses the form produced by {@link #toString()}. The family may itself contain
     * colons.
     */
    public static Optional<TypographyKey> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String[] parts = key.split(":");
        if (parts.length < 4) {
            return Optional.empty();
        }
        int n = parts.length;
        String family = String.join(":", Arrays.copyOfRange(parts, 0, n - 3));
        try {
            return Optional.of(of(family, Double.parseDouble(parts[n - 3]), Double.parseDouble(parts[n - 2]),
                    Double.parseDouble(parts[n - 1])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Same family and weight bucket, size within 1px, line height within 2px.
     */
    public boolean isCloseTo(TypographyKey other) {
        return family.toLowerCase(Locale.ROOT).equals(other.family.toLowerCase(Locale.ROOT))
                && weight == other.weight
                && Math.abs(size - other.size) <= SIZE_TOLERANCE
                && Math.abs(lineHeight - other.lineHeight) <= LINE_HEIGHT_TOLERANCE;
    }

    double distanceTo(TypographyKey other) {
        return Math.abs(size - other.size) + Math.abs(lineHeight - other.lineHeight);
    }

    @Override
    public String toString() {
        return family + ":" + Numbers.format(size) + ":" + weight + ":" + lineHeight;
    }
}
