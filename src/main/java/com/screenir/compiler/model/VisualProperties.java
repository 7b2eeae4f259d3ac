package com.screenir.compiler.model;

import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Effect;
import com.screenir.compiler.model.raw.Fill;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.model.raw.Stroke;
import com.screenir.compiler.model.raw.TypographyInfo;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * The paint-related properties of a node, carried unchanged from the raw tree
 * through normalization and layout into style extraction.
 */
@Value
@Builder(toBuilder = true)
public class VisualProperties {

    public static final VisualProperties NONE = VisualProperties.builder().build();

    @Singular
    List<Fill> fills;

    @Singular
    List<Stroke> strokes;

    @Singular
    List<Effect> effects;

    CornerRadius cornerRadius;

    @Builder.Default
    double opacity = 1.0;

    TypographyInfo typography;

    public static VisualProperties of(RawNode node) {
        return VisualProperties.builder()
                .fills(node.getFills())
                .strokes(node.getStrokes())
                .effects(node.getEffects())
                .cornerRadius(node.getCornerRadius())
                .opacity(node.getOpacity())
                .typography(node.getTypography())
                .build();
    }

    /**
     * True when the node paints something of its own: a fill, stroke, effect, a non-zero
     * corner radius or reduced opacity.
     */
    public boolean hasVisualTreatment() {
        return !fills.isEmpty()
                || !strokes.isEmpty()
                || !effects.isEmpty()
                || hasCornerRadius()
                || opacity != 1.0;
    }

    public boolean hasCornerRadius() {
        return cornerRadius != null && !cornerRadius.isZero();
    }

    public boolean hasSolidFill() {
        return fills.stream().anyMatch(Fill::isSolid);
    }

    public boolean hasImageFill() {
        return fills.stream().anyMatch(Fill::isImage);
    }

    public Optional<Fill> firstSolidFill() {
        return fills.stream().filter(Fill::isSolid).findFirst();
    }

    public Optional<Fill> firstImageFill() {
        return fills.stream().filter(Fill::isImage).findFirst();
    }

    public boolean hasDropShadow() {
        return effects.stream().anyMatch(Effect::isDropShadow);
    }
}
