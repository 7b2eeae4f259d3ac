package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.util.NamingUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups containers, cards and buttons by structural signature. Every signature seen
 * at least twice becomes a {@link ComponentHint}, in order of first occurrence.
 */
public class RepetitionDetector {

    private static final Logger log = LoggerFactory.getLogger(RepetitionDetector.class);

    static final int MIN_OCCURRENCES = 2;

    private static final int MIN_NAME_LENGTH = 3;

    public List<ComponentHint> detectRepetitions(IrNode root) {
        Map<String, List<IrNode>> nodesBySignature = new LinkedHashMap<>();
        collectNodes(root, nodesBySignature);

        List<ComponentHint> hints = new ArrayList<>();
        Map<String, Integer> nameCounts = new LinkedHashMap<>();
        for (List<IrNode> instances : nodesBySignature.values()) {
            if (instances.size() < MIN_OCCURRENCES) {
                continue;
            }
            String name = componentName(instances.get(0));
            int seen = nameCounts.merge(name, 1, Integer::sum);
            ComponentHint.ComponentHintBuilder builder = ComponentHint.builder()
                    .componentName(seen == 1 ? name : name + seen);
            instances.forEach(instance -> builder.instanceId(instance.getId()));
            mergePropsVariations(instances).forEach(builder::propsVariation);
            hints.add(builder.build());
        }
        log.debug("Detected {} repeated component(s) among {} signature(s)", hints.size(), nodesBySignature.size());
        return hints;
    }

    private void collectNodes(IrNode node, Map<String, List<IrNode>> nodesBySignature) {
        if (isExtractable(node)) {
            nodesBySignature.computeIfAbsent(StructuralSignature.calculate(node), key -> new ArrayList<>()).add(node);
        }
        for (IrNode child : node.getChildren()) {
            collectNodes(child, nodesBySignature);
        }
    }

    private static boolean isExtractable(IrNode node) {
        if (node.getSemanticType() == SemanticType.BUTTON) {
            return true;
        }
        return StructuralSignature.isContainerLike(node) && !node.getChildren().isEmpty();
    }

    static Map<String, List<String>> mergePropsVariations(List<IrNode> instances) {
        Map<String, List<String>> variations = new LinkedHashMap<>();
        for (IrNode instance : instances) {
            VariableProps.content(instance).forEach((key, value) -> {
                List<String> values = variations.computeIfAbsent(key, k -> new ArrayList<>());
                if (!values.contains(value)) {
                    values.add(value);
                }
            });
        }
        return variations;
    }

    static String componentName(IrNode node) {
        String cleaned = NamingUtil.toPascalCase(node.getName());
        if (cleaned.length() >= MIN_NAME_LENGTH && !NamingUtil.isGenericName(node.getName())) {
            return cleaned;
        }
        return switch (node.getSemanticType()) {
            case CARD -> "CardComponent";
            case CONTAINER -> "SectionComponent";
            case BUTTON -> "ActionButton";
            default -> "ExtractedComponent";
        };
    }
}
