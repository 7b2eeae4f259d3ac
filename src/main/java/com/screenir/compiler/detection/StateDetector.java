package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.styles.ExtractedStyle;
import com.screenir.compiler.styles.StyleDiff;
import com.screenir.compiler.styles.StylesBundle;
import com.screenir.compiler.styles.TypographyStyle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Infers a UI state from color variation across sibling instances.
 *
 * <p>Each instance is fingerprinted by the colors of its subtree (text content is
 * ignored). With exactly two fingerprints, a single odd instance among two or more
 * alike is a boolean state, and a near even split is a variant enum. Anything else
 * is not a state.
 */
public class StateDetector {

    private static final Logger log = LoggerFactory.getLogger(StateDetector.class);

    static final double BOOLEAN_CONFIDENCE = 0.9;
    static final double VARIANT_CONFIDENCE = 0.7;

    private static final String DEFAULT_STATE = "default";
    private static final String DEFAULT_STATE_NAME = "selected";
    private static final String PRIMARY_VARIANT = "primary";
    private static final String SECONDARY_VARIANT = "secondary";

    private static final List<String> STATE_KEYWORDS =
            List.of("active", "selected", "on", "pressed", "focused", "highlighted", "disabled");

    private static final Pattern WORD_SPLIT = Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z0-9])(?=[A-Z])");

    private static final Set<String> CONTAINER_STATE_PROPERTIES = Set.of(
            "backgroundColor", "backgroundGradient", "borderColor", "borderWidth", "borderRadius",
            "cornerRadii", "shadow", "opacity");

    private final StyleDiff styleDiff = new StyleDiff();

    public StateDetectionResult detect(List<IrNode> instances, StylesBundle bundle) {
        if (instances.size() < 2) {
            return StateDetectionResult.none();
        }

        Map<String, List<IrNode>> byFingerprint = new LinkedHashMap<>();
        for (IrNode instance : instances) {
            byFingerprint.computeIfAbsent(fingerprint(instance, bundle), key -> new ArrayList<>()).add(instance);
        }
        if (byFingerprint.size() != 2) {
            log.debug("{} style fingerprint(s) among {} instances: no state", byFingerprint.size(), instances.size());
            return StateDetectionResult.none();
        }

        List<List<IrNode>> groups = new ArrayList<>(byFingerprint.values());
        List<IrNode> first = groups.get(0);
        List<IrNode> second = groups.get(1);
        List<IrNode> minority = first.size() <= second.size() ? first : second;
        List<IrNode> majority = minority == first ? second : first;

        if (minority.size() == 1 && majority.size() >= 2) {
            return new StateDetectionResult(booleanState(instances, minority.get(0), majority.get(0), bundle),
                    BOOLEAN_CONFIDENCE);
        }
        if (majority.size() - minority.size() <= 1) {
            return new StateDetectionResult(variantState(instances, first, second, bundle), VARIANT_CONFIDENCE);
        }
        return StateDetectionResult.none();
    }

    private SemanticState booleanState(List<IrNode> instances, IrNode odd, IrNode typical, StylesBundle bundle) {
        String stateName = inferStateName(odd, instances);
        String propName = "is" + stateName.substring(0, 1).toUpperCase(Locale.ROOT) + stateName.substring(1);

        SemanticState.SemanticStateBuilder builder = SemanticState.builder()
                .type(stateTypeOf(stateName))
                .propName(propName)
                .propType(SemanticState.PropType.BOOLEAN)
                .defaultValue(Boolean.FALSE);
        for (IrNode instance : instances) {
            builder.instanceState(instance.getId(), instance == odd);
        }
        builder.stateStyle(DEFAULT_STATE, stateStyles(odd, typical, bundle));
        builder.stateStyle(stateName, stateStyles(typical, odd, bundle));
        return builder.build();
    }

    private SemanticState variantState(List<IrNode> instances, List<IrNode> primary, List<IrNode> secondary,
                                       StylesBundle bundle) {
        SemanticState.SemanticStateBuilder builder = SemanticState.builder()
                .type(StateType.VARIANT)
                .propName("variant")
                .propType(SemanticState.PropType.ENUM)
                .defaultValue(PRIMARY_VARIANT);
        for (IrNode instance : instances) {
            builder.instanceState(instance.getId(), primary.contains(instance) ? PRIMARY_VARIANT : SECONDARY_VARIANT);
        }
        builder.stateStyle(PRIMARY_VARIANT, stateStyles(secondary.get(0), primary.get(0), bundle));
        builder.stateStyle(SECONDARY_VARIANT, stateStyles(primary.get(0), secondary.get(0), bundle));
        return builder.build();
    }

    /**
     * Color-bearing props of the subtree, sorted by key.
     */
    static String fingerprint(IrNode instance, StylesBundle bundle) {
        return VariableProps.withStyles(instance, bundle).entrySet().stream()
                .filter(entry -> VariableProps.isColorKey(entry.getKey()))
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining("|"));
    }

    /**
     * Keyword from the odd instance's layer name, else from any instance, else "selected".
     */
    static String inferStateName(IrNode odd, List<IrNode> instances) {
        List<IrNode> candidates = new ArrayList<>();
        candidates.add(odd);
        candidates.addAll(instances);
        for (IrNode candidate : candidates) {
            List<String> words = words(candidate.getName());
            for (String keyword : STATE_KEYWORDS) {
                if (words.contains(keyword)) {
                    return keyword;
                }
            }
        }
        return DEFAULT_STATE_NAME;
    }

    private static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        for (String part : WORD_SPLIT.split(name)) {
            if (!part.isEmpty()) {
                words.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return words;
    }

    private static StateType stateTypeOf(String stateName) {
        return switch (stateName) {
            case "active" -> StateType.ACTIVE;
            case "disabled" -> StateType.DISABLED;
            default -> StateType.SELECTED;
        };
    }

    /**
     * Values {@code target} has where it differs from {@code base}. Both trees are walked
     * in pre-order and nodes at the same position are compared: visual properties of
     * non-text nodes, typography of text nodes. The first difference per property wins.
     */
    private StateStyles stateStyles(IrNode base, IrNode target, StylesBundle bundle) {
        Map<String, Object> containerStyles = new LinkedHashMap<>();
        Map<String, Object> textStyles = new LinkedHashMap<>();
        collectChanges(base, target, bundle, containerStyles, textStyles);
        return new StateStyles(containerStyles, textStyles);
    }

    private void collectChanges(IrNode base, IrNode target, StylesBundle bundle,
                                Map<String, Object> containerStyles, Map<String, Object> textStyles) {
        if (base instanceof TextIr && target instanceof TextIr) {
            TypographyStyle from = typographyOf(base, bundle);
            TypographyStyle to = typographyOf(target, bundle);
            if (from != null && to != null) {
                putIfChanged(textStyles, "color", from.getColor(), to.getColor());
                putIfChanged(textStyles, "fontWeight", from.getFontWeight(), to.getFontWeight());
                putIfChanged(textStyles, "fontSize", from.getFontSize(), to.getFontSize());
                putIfChanged(textStyles, "fontFamily", from.getFontFamily(), to.getFontFamily());
            }
            return;
        }
        ExtractedStyle baseStyle = bundle.getStyles().get(base.getStyleRef());
        ExtractedStyle targetStyle = bundle.getStyles().get(target.getStyleRef());
        if (baseStyle != null && targetStyle != null) {
            styleDiff.changes(baseStyle, targetStyle).forEach((property, value) -> {
                if (CONTAINER_STATE_PROPERTIES.contains(property)) {
                    containerStyles.putIfAbsent(property, value);
                }
            });
        }
        List<IrNode> baseChildren = base.getChildren();
        List<IrNode> targetChildren = target.getChildren();
        int shared = Math.min(baseChildren.size(), targetChildren.size());
        for (int i = 0; i < shared; i++) {
            collectChanges(baseChildren.get(i), targetChildren.get(i), bundle, containerStyles, textStyles);
        }
    }

    private static TypographyStyle typographyOf(IrNode node, StylesBundle bundle) {
        ExtractedStyle style = bundle.getStyles().get(node.getStyleRef());
        return style != null ? style.getTypography() : null;
    }

    private static void putIfChanged(Map<String, Object> styles, String key, Object from, Object to) {
        if (!Objects.equals(from, to)) {
            styles.putIfAbsent(key, to);
        }
    }
}
