package com.screenir.compiler.normalize;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Optional;

/**
 * Name heuristics for device chrome layers.
 */
@UtilityClass
class ChromeNames {

    static Optional<ChromeElement.Kind> kindOf(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("statusbar") || (lower.contains("status") && lower.contains("bar"))) {
            return Optional.of(ChromeElement.Kind.STATUS_BAR);
        }
        if (lower.contains("homeindicator") || (lower.contains("home") && lower.contains("indicator"))) {
            return Optional.of(ChromeElement.Kind.HOME_INDICATOR);
        }
        if (lower.contains("safearea") || (lower.contains("safe") && lower.contains("area"))) {
            return Optional.of(ChromeElement.Kind.SAFE_AREA);
        }
        if (lower.equals("navbar") || (lower.contains("navigation") && lower.contains("bar"))) {
            return Optional.of(ChromeElement.Kind.NAVIGATION_BAR);
        }
        return Optional.empty();
    }

    static FilterReason toFilterReason(ChromeElement.Kind kind) {
        return switch (kind) {
            case STATUS_BAR -> FilterReason.STATUS_BAR;
            case HOME_INDICATOR -> FilterReason.HOME_INDICATOR;
            case SAFE_AREA, NAVIGATION_BAR -> FilterReason.OS_COMPONENT;
        };
    }
}
