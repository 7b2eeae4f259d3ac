package com.screenir.compiler.recognize;

import com.screenir.compiler.ir.ButtonIr;
import com.screenir.compiler.ir.CardIr;
import com.screenir.compiler.ir.ComponentIr;
import com.screenir.compiler.ir.ContainerIr;
import com.screenir.compiler.ir.IconIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.RepeaterIr;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.util.NamingUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Collapses runs of contiguous siblings that share a base name (trailing digits
 * stripped) or a component id, and have the same node type and child count, into a
 * single {@link RepeaterIr}.
 */
public class RepeaterGrouper {

    private static final int MIN_BASE_NAME_LENGTH = 3;

    public List<IrNode> group(List<LayoutNode> children, Function<LayoutNode, IrNode> convert,
                              StyleRefGenerator styleRefs) {
        List<IrNode> result = new ArrayList<>();
        int i = 0;
        while (i < children.size()) {
            LayoutNode current = children.get(i);
            String baseName = baseName(current.getName());

            int count = 1;
            while (i + count < children.size() && belongTogether(current, baseName, children.get(i + count))) {
                count++;
            }

            if (count >= 2) {
                List<IrNode> items = new ArrayList<>(count);
                for (LayoutNode item : children.subList(i, i + count)) {
                    items.add(convert.apply(item));
                }
                result.add(toRepeater(current, baseName, items, styleRefs));
            } else {
                result.add(convert.apply(current));
            }
            i += count;
        }
        return result;
    }

    static String baseName(String name) {
        return name.replaceAll("\\d+$", "").trim();
    }

    private boolean belongTogether(LayoutNode first, String baseName, LayoutNode next) {
        boolean sameName = baseName.length() >= MIN_BASE_NAME_LENGTH && baseName.equals(baseName(next.getName()));
        boolean sameComponent = first.getComponentId() != null
                && first.getComponentId().equals(next.getComponentId());
        boolean sameShape = first.getType() == next.getType()
                && first.getChildren().size() == next.getChildren().size();
        return (sameName || sameComponent) && sameShape;
    }

    private RepeaterIr toRepeater(LayoutNode first, String baseName, List<IrNode> items,
                                  StyleRefGenerator styleRefs) {
        String itemName = baseName.isEmpty() ? "Item" : baseName;
        String identifier = NamingUtil.toValidIdentifier(itemName);
        return RepeaterIr.builder()
                .id("repeater_" + first.getId())
                .name(itemName + " (Repeater)")
                .boundingBox(union(items))
                .styleRef(styleRefs.unique("style_" + identifier + "_repeater"))
                .itemComponentName(NamingUtil.toPascalCase(itemName))
                .dataPropName(identifier.toUpperCase(Locale.ROOT) + "_DATA")
                .layout(layoutOf(items.get(0)))
                .propsVariations(textVariations(items))
                .children(items)
                .build();
    }

    /**
     * Texts at the same pre-order position that differ across items, keyed by the
     * template's text layer name.
     */
    private Map<String, List<String>> textVariations(List<IrNode> items) {
        List<List<TextIr>> texts = new ArrayList<>();
        for (IrNode item : items) {
            List<TextIr> found = new ArrayList<>();
            item.walk(node -> {
                if (node instanceof TextIr text) {
                    found.add(text);
                }
            });
            texts.add(found);
        }

        Map<String, List<String>> variations = new LinkedHashMap<>();
        List<TextIr> template = texts.get(0);
        for (int position = 0; position < template.size(); position++) {
            List<String> values = new ArrayList<>();
            Set<String> distinct = new LinkedHashSet<>();
            for (List<TextIr> itemTexts : texts) {
                String value = position < itemTexts.size() ? itemTexts.get(position).getText() : "";
                values.add(value);
                distinct.add(value);
            }
            if (distinct.size() > 1) {
                String key = NamingUtil.toValidIdentifier(template.get(position).getName());
                variations.putIfAbsent(key.isEmpty() ? "text" + position : key, values);
            }
        }
        return variations;
    }

    private static LayoutMeta layoutOf(IrNode node) {
        LayoutMeta layout = null;
        if (node instanceof ContainerIr container) {
            layout = container.getLayout();
        } else if (node instanceof CardIr card) {
            layout = card.getLayout();
        } else if (node instanceof ComponentIr component) {
            layout = component.getLayout();
        } else if (node instanceof ButtonIr button) {
            layout = button.getLayout();
        } else if (node instanceof IconIr icon) {
            layout = icon.getLayout();
        }
        return Objects.requireNonNullElseGet(layout, LayoutMeta::emptyColumn);
    }

    private static BoundingBox union(List<IrNode> items) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (IrNode item : items) {
            BoundingBox box = item.getBoundingBox();
            minX = Math.min(minX, box.getX());
            minY = Math.min(minY, box.getY());
            maxX = Math.max(maxX, box.getRight());
            maxY = Math.max(maxY, box.getBottom());
        }
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }
}
