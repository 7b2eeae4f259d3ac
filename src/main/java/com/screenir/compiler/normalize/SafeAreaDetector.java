package com.screenir.compiler.normalize;

import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.RawNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds device chrome on a screen and derives safe-area insets from it.
 * Named chrome is found anywhere in the tree; unnamed status bars and home indicators
 * are recognized by edge position and size among the screen's direct children.
 */
public class SafeAreaDetector {

    private static final Logger log = LoggerFactory.getLogger(SafeAreaDetector.class);

    private static final BoundingBox DEFAULT_SCREEN = new BoundingBox(0, 0, 375, 812);

    private static final double EDGE_TOLERANCE = 5;
    private static final double MIN_FULL_WIDTH = 365;
    private static final double STATUS_BAR_MIN_HEIGHT = 18;
    private static final double STATUS_BAR_MAX_HEIGHT = 64;
    private static final double HOME_INDICATOR_MIN_HEIGHT = 30;
    private static final double HOME_INDICATOR_MAX_HEIGHT = 40;

    public SafeAreaDetection detect(RawNode root, Conventions conventions) {
        BoundingBox screen = root.getBoundingBox() != null ? root.getBoundingBox() : DEFAULT_SCREEN;

        List<ChromeElement> elements = new ArrayList<>();
        for (RawNode child : root.getChildren()) {
            Optional<ChromeElement.Kind> kind = ChromeNames.kindOf(child.getName());
            if (kind.isEmpty() && conventions.isGeometryHeuristics()) {
                kind = kindByGeometry(child, screen);
            }
            if (kind.isPresent()) {
                addElement(elements, child, kind.get());
            } else {
                collectNamedChrome(child, elements);
            }
        }

        if (elements.isEmpty()) {
            return SafeAreaDetection.NONE;
        }

        Set<String> excludeIds = new LinkedHashSet<>();
        for (ChromeElement element : elements) {
            excludeIds.add(element.getId());
        }

        SafeAreaInsets insets = calculateInsets(elements, screen);
        log.debug("Detected {} chrome element(s), insets {}", elements.size(), insets);
        return new SafeAreaDetection(insets, List.copyOf(elements), Set.copyOf(excludeIds), true);
    }

    private void collectNamedChrome(RawNode node, List<ChromeElement> elements) {
        for (RawNode child : node.getChildren()) {
            Optional<ChromeElement.Kind> kind = ChromeNames.kindOf(child.getName());
            if (kind.isPresent()) {
                addElement(elements, child, kind.get());
            } else {
                collectNamedChrome(child, elements);
            }
        }
    }

    private void addElement(List<ChromeElement> elements, RawNode node, ChromeElement.Kind kind) {
        if (!node.isVisible() || node.getBoundingBox() == null) {
            return;
        }
        elements.add(new ChromeElement(node.getId(), node.getName(), kind, node.getBoundingBox()));
    }

    private Optional<ChromeElement.Kind> kindByGeometry(RawNode node, BoundingBox screen) {
        BoundingBox box = node.getBoundingBox();
        if (box == null || !node.isVisible() || box.getWidth() < MIN_FULL_WIDTH) {
            return Optional.empty();
        }
        boolean atTop = Math.abs(box.getY() - screen.getY()) < EDGE_TOLERANCE;
        if (atTop && box.getHeight() >= STATUS_BAR_MIN_HEIGHT && box.getHeight() <= STATUS_BAR_MAX_HEIGHT) {
            return Optional.of(ChromeElement.Kind.STATUS_BAR);
        }
        boolean atBottom = Math.abs(box.getBottom() - screen.getBottom()) < EDGE_TOLERANCE;
        if (atBottom && box.getHeight() >= HOME_INDICATOR_MIN_HEIGHT && box.getHeight() <= HOME_INDICATOR_MAX_HEIGHT) {
            return Optional.of(ChromeElement.Kind.HOME_INDICATOR);
        }
        return Optional.empty();
    }

    private SafeAreaInsets calculateInsets(List<ChromeElement> elements, BoundingBox screen) {
        double top = 0;
        double bottom = 0;
        double left = 0;
        double right = 0;

        for (ChromeElement element : elements) {
            BoundingBox box = element.getBoundingBox();
            switch (element.getKind()) {
                case STATUS_BAR -> top = Math.max(top, box.getBottom() - screen.getY());
                case HOME_INDICATOR, NAVIGATION_BAR -> bottom = Math.max(bottom, screen.getBottom() - box.getY());
                case SAFE_AREA -> {
                    // A safe-area layer spans the usable region; its margins are the insets.
                    top = Math.max(top, box.getY() - screen.getY());
                    bottom = Math.max(bottom, screen.getBottom() - box.getBottom());
                    left = Math.max(left, box.getX() - screen.getX());
                    right = Math.max(right, screen.getRight() - box.getRight());
                }
            }
        }
        return new SafeAreaInsets(top, bottom, left, right);
    }
}
