package com.screenir.compiler.normalize;

import com.screenir.compiler.util.GlobMatcher;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * Naming and chrome conventions applied while normalizing a design tree.
 * Passed per invocation; {@link #defaults()} documents the default set.
 */
@Value
@Builder(toBuilder = true)
public class Conventions {

    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            "*annotation*",
            "*measure*",
            "*measurement*",
            "*redline*",
            "*spec*",
            "*-guide",
            "*_guide",
            "_*");

    public static final List<String> DEFAULT_OS_CHROME_PATTERNS = List.of(
            "StatusBar",
            "Status Bar",
            "_StatusBar*",
            "*StatusBar*",
            "Home Indicator",
            "HomeIndicator",
            "*Home Indicator*",
            "*HomeIndicator*",
            "iPhone*Overlay",
            "iPhone*Frame",
            "Device Frame",
            "Device Overlay",
            "Navigation Bar",
            "NavigationBar",
            "System Bar",
            "SystemBar",
            "*Device Chrome*",
            "*Safe Area*",
            "SafeArea");

    /**
     * Layer-name globs for annotations, guides and other design-only layers.
     */
    @Singular
    List<String> ignorePatterns;

    /**
     * Layer-name globs for device chrome (status bar, home indicator, overlays).
     */
    @Singular
    List<String> osChromePatterns;

    /**
     * Detect unnamed status bars and home indicators by position and size among the
     * screen's direct children.
     */
    @Builder.Default
    boolean geometryHeuristics = true;

    /**
     * Promote the children of multi-child wrapper groups into their parent.
     */
    @Builder.Default
    boolean flattenWrapperGroups = false;

    public static Conventions defaults() {
        return Conventions.builder()
                .ignorePatterns(DEFAULT_IGNORE_PATTERNS)
                .osChromePatterns(DEFAULT_OS_CHROME_PATTERNS)
                .build();
    }

    /**
     * Copy with the ignore set replaced. Chrome patterns are kept.
     */
    public Conventions withIgnorePatterns(Collection<String> patterns) {
        return toBuilder().clearIgnorePatterns().ignorePatterns(patterns).build();
    }

    public boolean isIgnored(String name) {
        return matchesAny(name, ignorePatterns);
    }

    public boolean isOsChrome(String name) {
        return matchesAny(name, osChromePatterns);
    }

    private static boolean matchesAny(String name, List<String> globs) {
        return globs.stream().anyMatch(glob -> GlobMatcher.of(glob).matches(name));
    }
}
