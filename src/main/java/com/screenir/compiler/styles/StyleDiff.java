package com.screenir.compiler.styles;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compares two extracted styles property by property. The style id is not compared.
 */
public class StyleDiff {

    private static final Map<String, Function<ExtractedStyle, Object>> PROPERTIES = new LinkedHashMap<>();

    static {
        PROPERTIES.put("backgroundColor", ExtractedStyle::getBackgroundColor);
        PROPERTIES.put("backgroundGradient", ExtractedStyle::getBackgroundGradient);
        PROPERTIES.put("borderColor", ExtractedStyle::getBorderColor);
        PROPERTIES.put("borderWidth", ExtractedStyle::getBorderWidth);
        PROPERTIES.put("borderRadius", ExtractedStyle::getBorderRadius);
        PROPERTIES.put("cornerRadii", ExtractedStyle::getCornerRadii);
        PROPERTIES.put("shadow", ExtractedStyle::getShadow);
        PROPERTIES.put("typography", ExtractedStyle::getTypography);
        PROPERTIES.put("width", ExtractedStyle::getWidth);
        PROPERTIES.put("height", ExtractedStyle::getHeight);
        PROPERTIES.put("position", ExtractedStyle::getPosition);
        PROPERTIES.put("left", ExtractedStyle::getLeft);
        PROPERTIES.put("right", ExtractedStyle::getRight);
        PROPERTIES.put("top", ExtractedStyle::getTop);
        PROPERTIES.put("bottom", ExtractedStyle::getBottom);
        PROPERTIES.put("opacity", ExtractedStyle::getOpacity);
        PROPERTIES.put("flexDirection", ExtractedStyle::getFlexDirection);
        PROPERTIES.put("justifyContent", ExtractedStyle::getJustifyContent);
        PROPERTIES.put("alignItems", ExtractedStyle::getAlignItems);
        PROPERTIES.put("alignSelf", ExtractedStyle::getAlignSelf);
        PROPERTIES.put("gap", ExtractedStyle::getGap);
        PROPERTIES.put("padding", ExtractedStyle::getPadding);
        PROPERTIES.put("flex", ExtractedStyle::getFlex);
    }

    /**
     * Names of the properties whose values differ, in declaration order.
     */
    public List<String> differingProperties(ExtractedStyle a, ExtractedStyle b) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Function<ExtractedStyle, Object>> property : PROPERTIES.entrySet()) {
            if (!Objects.equals(property.getValue().apply(a), property.getValue().apply(b))) {
                names.add(property.getKey());
            }
        }
        return names;
    }

    /**
     * The values {@code variant} has where it differs from {@code base}. A property the
     * variant lacks maps to {@code null}.
     */
    public Map<String, Object> changes(ExtractedStyle base, ExtractedStyle variant) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String name : differingProperties(base, variant)) {
            changes.put(name, PROPERTIES.get(name).apply(variant));
        }
        return changes;
    }
}
