package com.screenir.compiler.mapping;

import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An 8-bit RGB color with alpha, parsed from {@code #RGB}, {@code #RRGGBB},
 * {@code #RRGGBBAA} or {@code rgb()/rgba()} notation.
 */
@Value
public class HexColor {

    private static final Pattern HEX = Pattern.compile("#?([0-9A-Fa-f]{3}|[0-9A-Fa-f]{6}|[0-9A-Fa-f]{8})");
    private static final Pattern RGB = Pattern.compile(
            "rgba?\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*(?:,\\s*([0-9.]+)\\s*)?\\)",
            Pattern.CASE_INSENSITIVE);

    static final double SOLID_ALPHA = 0.99;

    int red;
    int green;
    int blue;
    double alpha;

    public static Optional<HexColor> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        Matcher hex = HEX.matcher(trimmed);
        if (hex.matches()) {
            String digits = hex.group(1);
            if (digits.length() == 3) {
                StringBuilder expanded = new StringBuilder();
                for (char c : digits.toCharArray()) {
                    expanded.append(c).append(c);
                }
                digits = expanded.toString();
            }
            double alpha = digits.length() == 8 ? Integer.parseInt(digits.substring(6, 8), 16) / 255.0 : 1.0;
            return Optional.of(new HexColor(
                    Integer.parseInt(digits.substring(0, 2), 16),
                    Integer.parseInt(digits.substring(2, 4), 16),
                    Integer.parseInt(digits.substring(4, 6), 16),
                    alpha));
        }
        Matcher rgb = RGB.matcher(trimmed);
        if (rgb.matches()) {
            int r = Integer.parseInt(rgb.group(1));
            int g = Integer.parseInt(rgb.group(2));
            int b = Integer.parseInt(rgb.group(3));
            if (r > 255 || g > 255 || b > 255) {
                return Optional.empty();
            }
            double alpha = 1.0;
            if (rgb.group(4) != null) {
                try {
                    alpha = Double.parseDouble(rgb.group(4));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            return Optional.of(new HexColor(r, g, b, alpha));
        }
        return Optional.empty();
    }

    /**
     * Six-digit uppercase form, alpha dropped.
     */
    public String toRgbHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    /**
     * Six-digit form for solid colors, eight-digit form with the alpha byte otherwise.
     */
    public String toHex() {
        if (isSolid()) {
            return toRgbHex();
        }
        return toRgbHex() + String.format(Locale.ROOT, "%02X", Math.round(alpha * 255));
    }

    public boolean isSolid() {
        return alpha >= SOLID_ALPHA;
    }
}
