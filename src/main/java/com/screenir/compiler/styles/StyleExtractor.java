package com.screenir.compiler.styles;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.layout.LayoutType;
import com.screenir.compiler.layout.Sizing;
import com.screenir.compiler.model.VisualProperties;
import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Effect;
import com.screenir.compiler.model.raw.Fill;
import com.screenir.compiler.model.raw.GradientStop;
import com.screenir.compiler.model.raw.RgbaColor;
import com.screenir.compiler.model.raw.Stroke;
import com.screenir.compiler.model.raw.TypographyInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fourth pipeline stage: one {@link ExtractedStyle} per IR node plus the document's
 * design tokens.
 */
public class StyleExtractor {

    private static final Logger log = LoggerFactory.getLogger(StyleExtractor.class);

    private static final String DEFAULT_TEXT_COLOR = "#000000";

    private final VisualPropsCollector propsCollector;
    private final TokenCollector tokenCollector;

    public StyleExtractor() {
        this(new VisualPropsCollector(), new TokenCollector());
    }

    public StyleExtractor(VisualPropsCollector propsCollector, TokenCollector tokenCollector) {
        this.propsCollector = propsCollector;
        this.tokenCollector = tokenCollector;
    }

    /**
     * @param ir         the recognized tree
     * @param layoutRoot the layout tree the IR was recognized from
     */
    public StylesBundle extract(IrNode ir, LayoutNode layoutRoot) {
        return extract(ir, propsCollector.collect(layoutRoot));
    }

    public StylesBundle extract(IrNode ir, Map<String, NodeVisualProps> propsById) {
        Map<String, ExtractedStyle> styles = new LinkedHashMap<>();
        ir.walk(node -> {
            NodeVisualProps props = propsById.get(node.getId());
            if (props != null) {
                styles.put(node.getStyleRef(), extractStyle(node.getStyleRef(), props));
            } else {
                // synthesized nodes (repeaters, circular placeholders) have no source layer
                styles.put(node.getStyleRef(), ExtractedStyle.builder().id(node.getStyleRef()).build());
            }
        });
        DesignTokens tokens = tokenCollector.collect(styles.values());
        log.debug("Extracted {} style(s), {} color token(s)", styles.size(), tokens.getColors().size());
        return new StylesBundle(Collections.unmodifiableMap(styles), tokens);
    }

    public ExtractedStyle extractStyle(String styleRef, NodeVisualProps props) {
        VisualProperties visuals = props.getVisuals();
        ExtractedStyle.ExtractedStyleBuilder style = ExtractedStyle.builder().id(styleRef);

        // a text layer's fill is its text color, never a background
        if (visuals.getTypography() != null) {
            style.typography(typographyOf(visuals.getTypography(), visuals.getFills()));
        } else {
            applyBackground(style, visuals.getFills());
        }
        applyBorder(style, visuals.getStrokes());
        applyCornerRadius(style, visuals.getCornerRadius());
        shadowOf(visuals.getEffects()).ifPresent(style::shadow);

        style.width((double) Math.round(props.getWidth()));
        style.height((double) Math.round(props.getHeight()));

        AbsoluteOffsets offsets = props.getAbsoluteOffsets();
        if (offsets != null) {
            style.position(Position.ABSOLUTE)
                    .left(rounded(offsets.getLeft()))
                    .right(rounded(offsets.getRight()))
                    .top(rounded(offsets.getTop()))
                    .bottom(rounded(offsets.getBottom()));
            if (offsets.isStretchWidth()) {
                style.width(null);
            }
            if (offsets.isStretchHeight()) {
                style.height(null);
            }
        }

        if (visuals.getOpacity() != 1.0) {
            style.opacity(visuals.getOpacity());
        }

        if (props.getLayout() != null) {
            applyFlex(style, props.getLayout());
            applyFlexItem(style, props.getLayout(), props.getParentLayoutType());
        }
        return style.build();
    }

    private void applyBackground(ExtractedStyle.ExtractedStyleBuilder style, List<Fill> fills) {
        Optional<Fill> visible = fills.stream().filter(f -> f.getOpacity() > 0).findFirst();
        if (visible.isEmpty()) {
            return;
        }
        Fill fill = visible.get();
        if (fill.isSolid() && fill.getColor() != null) {
            style.backgroundColor(ColorFormatter.toHex(fill.getColor(), fill.getOpacity()));
        } else if (fill.isGradient() && !fill.getGradientStops().isEmpty()) {
            List<String> colors = new ArrayList<>();
            List<Double> positions = new ArrayList<>();
            for (GradientStop stop : fill.getGradientStops()) {
                colors.add(ColorFormatter.toHex(stop.getColor(), fill.getOpacity()));
                positions.add(stop.getPosition());
            }
            style.backgroundGradient(new GradientStyle(fill.getGradientType(), List.copyOf(colors),
                    List.copyOf(positions)));
        }
    }

    private void applyBorder(ExtractedStyle.ExtractedStyleBuilder style, List<Stroke> strokes) {
        if (strokes.isEmpty()) {
            return;
        }
        Stroke stroke = strokes.get(0);
        if (stroke.getColor() != null) {
            style.borderColor(ColorFormatter.toHex(stroke.getColor(), stroke.getOpacity()));
        }
        if (stroke.getWeight() != 0) {
            style.borderWidth(stroke.getWeight());
        }
    }

    private void applyCornerRadius(ExtractedStyle.ExtractedStyleBuilder style, CornerRadius radius) {
        if (radius == null || radius.isZero()) {
            return;
        }
        if (radius.isUniform()) {
            style.borderRadius(radius.getTopLeft());
        } else {
            style.cornerRadii(radius);
        }
    }

    private Optional<ShadowStyle> shadowOf(List<Effect> effects) {
        return effects.stream()
                .filter(Effect::isDropShadow)
                .findFirst()
                .map(e -> new ShadowStyle(
                        ColorFormatter.toHex(e.getColor() != null ? e.getColor() : RgbaColor.BLACK, 1),
                        e.getOffsetX(), e.getOffsetY(), e.getRadius(), e.getSpread()));
    }

    private TypographyStyle typographyOf(TypographyInfo typography, List<Fill> fills) {
        String color = fills.stream()
                .filter(f -> f.isSolid() && f.getColor() != null)
                .findFirst()
                .map(f -> ColorFormatter.toHex(f.getColor(), f.getOpacity()))
                .or(() -> fills.stream()
                        .filter(f -> f.isGradient() && !f.getGradientStops().isEmpty())
                        .findFirst()
                        .map(f -> ColorFormatter.toHex(f.getGradientStops().get(0).getColor(), f.getOpacity())))
                .orElse(DEFAULT_TEXT_COLOR);
        return new TypographyStyle(typography.getFontFamily(), typography.getFontSize(), typography.getFontWeight(),
                typography.getLineHeight(), typography.getLetterSpacing(), typography.getTextAlign(), color);
    }

    private void applyFlex(ExtractedStyle.ExtractedStyleBuilder style, LayoutMeta layout) {
        LayoutType type = layout.getType();
        if (type == LayoutType.ABSOLUTE) {
            return;
        }
        style.flexDirection(type == LayoutType.ROW ? "row" : "column");
        if (layout.getGap() != 0) {
            style.gap(layout.getGap());
        }
        if (!layout.getPadding().isZero()) {
            style.padding(layout.getPadding());
        }

        switch (layout.getMainAlign()) {
            case CENTER -> style.justifyContent("center");
            case END -> style.justifyContent("flex-end");
            case SPACE_BETWEEN -> style.justifyContent("space-between");
            case SPACE_AROUND -> style.justifyContent("space-around");
            default -> {
                // start is the flex default
            }
        }
        switch (layout.getCrossAlign()) {
            case CENTER -> style.alignItems("center");
            case END -> style.alignItems("flex-end");
            case STRETCH -> style.alignItems("stretch");
            case BASELINE -> style.alignItems("baseline");
            default -> {
                // start is the flex default
            }
        }
    }

    /**
     * Sizing relative to the parent: fill on the parent's main axis grows, fill on its
     * cross axis stretches, and hugging drops the fixed dimension.
     */
    private void applyFlexItem(ExtractedStyle.ExtractedStyleBuilder style, LayoutMeta layout, LayoutType parentType) {
        if (parentType == LayoutType.ROW) {
            if (layout.getHorizontalSizing() == Sizing.FILL) {
                style.flex(1.0);
            }
            if (layout.getVerticalSizing() == Sizing.FILL) {
                style.alignSelf("stretch");
            }
        } else if (parentType == LayoutType.COLUMN) {
            if (layout.getVerticalSizing() == Sizing.FILL) {
                style.flex(1.0);
            }
            if (layout.getHorizontalSizing() == Sizing.FILL) {
                style.alignSelf("stretch");
            }
        }
        if (layout.getHorizontalSizing() == Sizing.HUG) {
            style.width(null);
        }
        if (layout.getVerticalSizing() == Sizing.HUG) {
            style.height(null);
        }
    }

    private static Double rounded(Double value) {
        return value == null ? null : (double) Math.round(value);
    }
}
