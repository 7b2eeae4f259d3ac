package com.screenir.compiler.detection;

import com.screenir.compiler.ir.ButtonIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.styles.ExtractedStyle;
import com.screenir.compiler.styles.StylesBundle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens the per-instance values of an IR subtree into {@code path -> value} pairs.
 * Descendants are prefixed {@code child<i>_}, so {@code child0_child1_text} is the text
 * of the second child of the first child.
 */
final class VariableProps {

    static final String TEXT = "text";
    static final String LABEL = "label";
    static final String BACKGROUND_COLOR = "backgroundColor";
    static final String BORDER_COLOR = "borderColor";
    static final String TEXT_COLOR = "color";

    private VariableProps() {
    }

    /**
     * Text content and button labels only.
     */
    static Map<String, String> content(IrNode node) {
        Map<String, String> props = new LinkedHashMap<>();
        collect(node, "", null, props);
        return props;
    }

    /**
     * Content plus the colors of each node's extracted style.
     */
    static Map<String, String> withStyles(IrNode node, StylesBundle bundle) {
        Map<String, String> props = new LinkedHashMap<>();
        collect(node, "", bundle, props);
        return props;
    }

    static boolean isColorKey(String key) {
        return key.endsWith(BACKGROUND_COLOR) || key.endsWith(BORDER_COLOR)
                || key.equals(TEXT_COLOR) || key.endsWith("_" + TEXT_COLOR);
    }

    private static void collect(IrNode node, String prefix, StylesBundle bundle, Map<String, String> props) {
        if (node instanceof TextIr text) {
            props.put(prefix + TEXT, text.getText());
        } else if (node instanceof ButtonIr button) {
            props.put(prefix + LABEL, button.getLabel());
        }

        if (bundle != null) {
            ExtractedStyle style = bundle.getStyles().get(node.getStyleRef());
            if (style != null) {
                putIfPresent(props, prefix + BACKGROUND_COLOR, style.getBackgroundColor());
                putIfPresent(props, prefix + BORDER_COLOR, style.getBorderColor());
                if (style.getTypography() != null) {
                    putIfPresent(props, prefix + TEXT_COLOR, style.getTypography().getColor());
                }
            }
        }

        List<IrNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            collect(children.get(i), prefix + "child" + i + "_", bundle, props);
        }
    }

    private static void putIfPresent(Map<String, String> props, String key, String value) {
        if (value != null) {
            props.put(key, value);
        }
    }
}
