package com.screenir.compiler.recognize;

import com.screenir.compiler.ir.ComponentProp;
import com.screenir.compiler.ir.ImageIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.util.NamingUtil;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Harvests text and image content of a component instance as named properties.
 * Repeater subtrees are data, not props, and are skipped.
 */
public class ComponentPropExtractor {

    public Map<String, ComponentProp> extract(List<IrNode> children) {
        Map<String, ComponentProp> props = new LinkedHashMap<>();
        Map<String, String> seen = new HashMap<>();
        for (IrNode child : children) {
            traverse(child, props, seen);
        }
        return props;
    }

    private void traverse(IrNode node, Map<String, ComponentProp> props, Map<String, String> seen) {
        if (node.getSemanticType() == SemanticType.REPEATER) {
            return;
        }
        if (node instanceof TextIr text && !text.getText().isEmpty()) {
            register(props, seen, propNameForText(node.getName()), ComponentProp.Kind.STRING,
                    node.getName(), text.getText());
        } else if (node instanceof ImageIr image) {
            String ref = image.getImageRef() != null ? image.getImageRef() : "";
            register(props, seen, fallback(NamingUtil.toValidIdentifier(node.getName()), "image"),
                    ComponentProp.Kind.IMAGE, node.getName(), ref);
        }
        for (IrNode child : node.getChildren()) {
            traverse(child, props, seen);
        }
    }

    private void register(Map<String, ComponentProp> props, Map<String, String> seen, String propName,
                          ComponentProp.Kind kind, String nodeName, String value) {
        String contentKey = nodeName + "|" + kind + "|" + value;
        if (seen.containsKey(contentKey)) {
            return;
        }
        String finalName = propName;
        int counter = 1;
        while (props.containsKey(finalName) && !props.get(finalName).getValue().equals(value)) {
            finalName = propName + counter++;
        }
        props.putIfAbsent(finalName, new ComponentProp(kind, value, value));
        seen.put(contentKey, finalName);
    }

    static String propNameForText(String nodeName) {
        String lower = nodeName == null ? "" : nodeName.toLowerCase(Locale.ROOT);
        if (lower.contains("title") || lower.equals("header") || lower.equals("headline")) {
            return "title";
        }
        if (lower.contains("description") || lower.contains("subtitle") || lower.contains("body")) {
            return "description";
        }
        if (lower.equals("label") || lower.equals("placeholder")) {
            return lower;
        }
        if (lower.contains("price")) {
            return "price";
        }
        if (lower.contains("date") || lower.contains("time")) {
            return "dateTime";
        }
        return fallback(NamingUtil.toValidIdentifier(nodeName), "text");
    }

    private static String fallback(String name, String defaultName) {
        return name == null || name.isEmpty() ? defaultName : name;
    }
}
