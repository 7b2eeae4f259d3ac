package com.screenir.compiler.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.model.raw.AutoLayout;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.Constraints;
import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Effect;
import com.screenir.compiler.model.raw.Fill;
import com.screenir.compiler.model.raw.GradientStop;
import com.screenir.compiler.model.raw.NodeType;
import com.screenir.compiler.model.raw.Padding;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.model.raw.RgbaColor;
import com.screenir.compiler.model.raw.Stroke;
import com.screenir.compiler.model.raw.TypographyInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a design tool's REST JSON into a {@link RawNode} tree.
 *
 * <p>Accepts a file response ({@code document}), a nodes response
 * ({@code nodes.<id>.document}, first entry) or a bare node object. Hidden and
 * zero-opacity fills, hidden strokes and hidden effects are dropped while reading.
 */
public class DesignDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(DesignDocumentReader.class);

    static final double LINE_HEIGHT_FACTOR = 1.2;

    private final ObjectMapper objectMapper;

    public DesignDocumentReader() {
        this(new ObjectMapper());
    }

    public DesignDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RawNode read(Path file) {
        log.debug("Reading design document {}", file);
        try {
            return toRawNode(locateRoot(objectMapper.readTree(Files.readString(file))));
        } catch (JsonProcessingException e) {
            throw new DesignDocumentException("Malformed design document " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DesignDocumentException("Cannot read design document " + file, e);
        }
    }

    public RawNode parse(String json) {
        try {
            return toRawNode(locateRoot(objectMapper.readTree(json)));
        } catch (JsonProcessingException e) {
            throw new DesignDocumentException("Malformed design document: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode locateRoot(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new DesignDocumentException("Design document must be a JSON object");
        }
        if (json.path("document").isObject()) {
            return json.get("document");
        }
        JsonNode nodes = json.path("nodes");
        if (nodes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                if (entry.getValue().path("document").isObject()) {
                    log.debug("Using node {} of nodes response", entry.getKey());
                    return entry.getValue().get("document");
                }
            }
            throw new DesignDocumentException("Nodes response contains no document");
        }
        return json;
    }

    RawNode toRawNode(JsonNode json) {
        NodeType type = NodeType.fromValue(json.path("type").asText(null));
        RawNode.RawNodeBuilder builder = RawNode.builder()
                .id(json.path("id").asText(null))
                .name(json.path("name").asText(""))
                .type(type)
                .visible(json.path("visible").asBoolean(true))
                .opacity(json.path("opacity").asDouble(1.0))
                .boundingBox(boundingBox(json.path("absoluteBoundingBox")))
                .cornerRadius(cornerRadius(json))
                .layoutGrow(json.path("layoutGrow").asDouble(0))
                .layoutAlign(enumValue(RawNode.LayoutAlign.class, json.path("layoutAlign"), null))
                .positioning(enumValue(RawNode.Positioning.class, json.path("layoutPositioning"), null))
                .overflowDirection(enumValue(RawNode.OverflowDirection.class, json.path("overflowDirection"),
                        RawNode.OverflowDirection.NONE))
                .primaryAxisSizing(enumValue(RawNode.SizingMode.class, json.path("primaryAxisSizingMode"), null))
                .counterAxisSizing(enumValue(RawNode.SizingMode.class, json.path("counterAxisSizingMode"), null))
                .autoLayout(autoLayout(json))
                .constraints(constraints(json.path("constraints")));

        if (json.hasNonNull("componentId")) {
            builder.componentId(json.get("componentId").asText());
        }
        if (type == NodeType.TEXT) {
            builder.characters(json.path("characters").asText(""));
            builder.typography(typography(json.path("style")));
        }

        for (JsonNode fill : json.path("fills")) {
            Fill parsed = fill(fill);
            if (parsed != null) {
                builder.fill(parsed);
            }
        }
        Stroke stroke = stroke(json);
        if (stroke != null) {
            builder.stroke(stroke);
        }
        for (JsonNode effect : json.path("effects")) {
            Effect parsed = effect(effect);
            if (parsed != null) {
                builder.effect(parsed);
            }
        }
        for (JsonNode child : json.path("children")) {
            if (child.isObject()) {
                builder.child(toRawNode(child));
            }
        }
        return builder.build();
    }

    private static BoundingBox boundingBox(JsonNode box) {
        if (!box.isObject()) {
            return null;
        }
        return new BoundingBox(box.path("x").asDouble(0), box.path("y").asDouble(0),
                box.path("width").asDouble(0), box.path("height").asDouble(0));
    }

    private static RgbaColor color(JsonNode color) {
        return new RgbaColor(color.path("r").asDouble(0), color.path("g").asDouble(0),
                color.path("b").asDouble(0), color.path("a").asDouble(1));
    }

    private static Fill fill(JsonNode fill) {
        if (!fill.path("visible").asBoolean(true)) {
            return null;
        }
        double opacity = fill.path("opacity").asDouble(1);
        if (opacity == 0) {
            return null;
        }
        String type = fill.path("type").asText("");
        return switch (type) {
            case "SOLID" -> fill.path("color").isObject() ? Fill.solid(color(fill.get("color")), opacity) : null;
            case "GRADIENT_LINEAR", "GRADIENT_RADIAL" -> gradient(fill, type, opacity);
            case "IMAGE" -> fill.hasNonNull("imageRef")
                    ? Fill.builder().type(Fill.Type.IMAGE).imageRef(fill.get("imageRef").asText()).opacity(opacity).build()
                    : null;
            default -> {
                log.debug("Ignoring unsupported fill type '{}'", type);
                yield null;
            }
        };
    }

    private static Fill gradient(JsonNode fill, String type, double opacity) {
        if (!fill.path("gradientStops").isArray()) {
            return null;
        }
        Fill.FillBuilder gradient = Fill.builder()
                .type(Fill.Type.GRADIENT)
                .gradientType("GRADIENT_LINEAR".equals(type) ? Fill.GradientType.LINEAR : Fill.GradientType.RADIAL)
                .opacity(opacity);
        for (JsonNode stop : fill.get("gradientStops")) {
            gradient.gradientStop(new GradientStop(stop.path("position").asDouble(0), color(stop.path("color"))));
        }
        return gradient.build();
    }

    /**
     * First stroke only, and only when it is a visible solid paint.
     */
    private static Stroke stroke(JsonNode json) {
        JsonNode strokes = json.path("strokes");
        if (!strokes.isArray() || strokes.isEmpty()) {
            return null;
        }
        JsonNode stroke = strokes.get(0);
        if (!stroke.path("visible").asBoolean(true) || !"SOLID".equals(stroke.path("type").asText())
                || !stroke.path("color").isObject()) {
            return null;
        }
        return new Stroke(color(stroke.get("color")), json.path("strokeWeight").asDouble(1),
                stroke.path("opacity").asDouble(1));
    }

    private static Effect effect(JsonNode effect) {
        if (!effect.path("visible").asBoolean(true)) {
            return null;
        }
        Effect.Type type = enumValue(Effect.Type.class, effect.path("type"), null);
        if (type == null) {
            return null;
        }
        Effect.EffectBuilder builder = Effect.builder()
                .type(type)
                .radius(effect.path("radius").asDouble(0));
        if (type == Effect.Type.DROP_SHADOW || type == Effect.Type.INNER_SHADOW) {
            if (!effect.path("color").isObject()) {
                return null;
            }
            builder.color(color(effect.get("color")))
                    .offsetX(effect.path("offset").path("x").asDouble(0))
                    .offsetY(effect.path("offset").path("y").asDouble(0))
                    .spread(effect.path("spread").asDouble(0));
        }
        return builder.build();
    }

    /**
     * Per-corner radii collapse to a uniform radius when all four are equal.
     */
    private static CornerRadius cornerRadius(JsonNode json) {
        JsonNode corners = json.path("rectangleCornerRadii");
        if (corners.isArray() && corners.size() == 4) {
            CornerRadius radius = new CornerRadius(corners.get(0).asDouble(0), corners.get(1).asDouble(0),
                    corners.get(2).asDouble(0), corners.get(3).asDouble(0));
            return radius.isUniform() ? CornerRadius.uniform(radius.getTopLeft()) : radius;
        }
        if (json.path("cornerRadius").isNumber()) {
            return CornerRadius.uniform(json.get("cornerRadius").asDouble());
        }
        return null;
    }

    private static TypographyInfo typography(JsonNode style) {
        TypographyInfo.TypographyInfoBuilder builder = TypographyInfo.builder();
        if (!style.isObject()) {
            return builder.lineHeight(14 * LINE_HEIGHT_FACTOR).build();
        }
        double fontSize = style.path("fontSize").asDouble(14);
        if (fontSize <= 0) {
            fontSize = 14;
        }
        String family = style.path("fontFamily").asText("");
        return builder
                .fontFamily(family.isBlank() ? "System" : family)
                .fontSize(fontSize)
                .fontWeight(style.path("fontWeight").asDouble(400))
                .lineHeight(style.path("lineHeightPx").asDouble(fontSize * LINE_HEIGHT_FACTOR))
                .letterSpacing(style.path("letterSpacing").asDouble(0))
                .textAlign(textAlign(style.path("textAlignHorizontal").asText("")))
                .build();
    }

    private static TypographyInfo.TextAlign textAlign(String align) {
        return switch (align) {
            case "CENTER" -> TypographyInfo.TextAlign.CENTER;
            case "RIGHT" -> TypographyInfo.TextAlign.RIGHT;
            case "JUSTIFIED" -> TypographyInfo.TextAlign.JUSTIFY;
            default -> TypographyInfo.TextAlign.LEFT;
        };
    }

    private static AutoLayout autoLayout(JsonNode json) {
        String mode = json.path("layoutMode").asText("NONE");
        if (!"HORIZONTAL".equals(mode) && !"VERTICAL".equals(mode)) {
            return null;
        }
        return AutoLayout.builder()
                .direction("HORIZONTAL".equals(mode) ? AutoLayout.Direction.HORIZONTAL : AutoLayout.Direction.VERTICAL)
                .gap(json.path("itemSpacing").asDouble(0))
                .padding(new Padding(json.path("paddingTop").asDouble(0), json.path("paddingRight").asDouble(0),
                        json.path("paddingBottom").asDouble(0), json.path("paddingLeft").asDouble(0)))
                .primaryAlign(enumValue(AutoLayout.PrimaryAlign.class, json.path("primaryAxisAlignItems"),
                        AutoLayout.PrimaryAlign.MIN))
                .counterAlign(enumValue(AutoLayout.CounterAlign.class, json.path("counterAxisAlignItems"),
                        AutoLayout.CounterAlign.MIN))
                .build();
    }

    private static Constraints constraints(JsonNode constraints) {
        if (!constraints.isObject()) {
            return null;
        }
        return new Constraints(
                enumValue(Constraints.Horizontal.class, constraints.path("horizontal"), null),
                enumValue(Constraints.Vertical.class, constraints.path("vertical"), null));
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode value, E fallback) {
        if (!value.isTextual()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown {} value '{}'", type.getSimpleName(), value.asText());
            return fallback;
        }
    }
}
