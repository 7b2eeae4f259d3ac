package com.screenir.compiler.normalize;

import com.screenir.compiler.model.raw.RawNode;

import java.util.Optional;

/**
 * Decides whether a raw node is excluded from the normalized tree.
 */
public class NodeFilter {

    /**
     * Hidden first, then device chrome, then the caller's ignore patterns.
     */
    public Optional<FilterReason> filterReason(RawNode node, Conventions conventions) {
        if (!node.isVisible()) {
            return Optional.of(FilterReason.HIDDEN);
        }

        String name = node.getName();
        Optional<ChromeElement.Kind> chromeKind = ChromeNames.kindOf(name);
        if (conventions.isOsChrome(name)) {
            return Optional.of(chromeKind.map(ChromeNames::toFilterReason).orElse(FilterReason.OS_COMPONENT));
        }
        if (chromeKind.isPresent()) {
            return Optional.of(ChromeNames.toFilterReason(chromeKind.get()));
        }

        if (conventions.isIgnored(name)) {
            return Optional.of(FilterReason.PATTERN_MATCH);
        }
        return Optional.empty();
    }
}
