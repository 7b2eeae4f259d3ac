package com.screenir.compiler.recognize;

import com.screenir.compiler.ir.ButtonIr;
import com.screenir.compiler.ir.ButtonVariant;
import com.screenir.compiler.ir.CardIr;
import com.screenir.compiler.ir.ComponentIr;
import com.screenir.compiler.ir.ContainerIr;
import com.screenir.compiler.ir.IconIr;
import com.screenir.compiler.ir.ImageIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.Fill;
import com.screenir.compiler.util.NamingUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Third pipeline stage: assigns every layout node exactly one semantic role.
 * <p>
 * The roles are tried in the order of {@link #getRules()}, most specific first, and
 * the first matching rule wins; anything unmatched is a Container.
 */
public class SemanticClassifier {

    private static final Logger log = LoggerFactory.getLogger(SemanticClassifier.class);

    private final ClassifierOptions options;
    private final NodePredicates predicates;
    private final List<ClassificationRule> rules;
    private final RepeaterGrouper repeaterGrouper;
    private final ComponentPropExtractor propExtractor;

    public SemanticClassifier() {
        this(ClassifierOptions.defaults());
    }

    public SemanticClassifier(ClassifierOptions options) {
        this.options = options;
        this.predicates = new NodePredicates(options);
        this.rules = List.of(
                new ClassificationRule(SemanticType.COMPONENT, predicates::isComponent),
                new ClassificationRule(SemanticType.TEXT, predicates::isText),
                new ClassificationRule(SemanticType.ICON, predicates::isIcon),
                new ClassificationRule(SemanticType.IMAGE, predicates::isImage),
                new ClassificationRule(SemanticType.BUTTON, predicates::isButton),
                new ClassificationRule(SemanticType.CARD, predicates::isCard));
        this.repeaterGrouper = new RepeaterGrouper();
        this.propExtractor = new ComponentPropExtractor();
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public SemanticType classify(LayoutNode node) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(node)) {
                return rule.getType();
            }
        }
        return SemanticType.CONTAINER;
    }

    /**
     * Converts a layout tree into IR. Style refs are unique within one call.
     */
    public IrNode recognize(LayoutNode root) {
        IrNode ir = toIr(root, new StyleRefGenerator());
        log.debug("Recognized '{}' as {} ({} IR node(s))", root.getName(),
                ir.getSemanticType().getDisplayName(), ir.countNodes());
        return ir;
    }

    private IrNode toIr(LayoutNode node, StyleRefGenerator styleRefs) {
        SemanticType type = classify(node);
        String styleRef = styleRefs.next(node.getName(), node.getId(), type);
        BoundingBox box = node.getBoundingBox();

        return switch (type) {
            case COMPONENT -> {
                List<IrNode> children = convertAll(node.getChildren(), styleRefs);
                yield ComponentIr.builder()
                        .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                        .componentId(node.getComponentId() != null ? node.getComponentId() : "unknown")
                        .componentName(NamingUtil.toPascalCase(node.getName()))
                        .props(propExtractor.extract(children))
                        .layout(node.getLayout())
                        .children(children)
                        .build();
            }
            case TEXT -> TextIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .text(node.getText())
                    .propName(NamingUtil.toValidIdentifier(node.getName()))
                    .defaultValue(node.getText())
                    .build();
            case ICON -> IconIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .iconRef(styleRef)
                    .size(Math.max(box.getWidth(), box.getHeight()))
                    .build();
            case IMAGE -> ImageIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .imageRef(node.getVisuals().firstImageFill().map(Fill::getImageRef).orElse(null))
                    .build();
            case BUTTON -> ButtonIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .label(buttonLabel(node))
                    .iconRef(buttonIconRef(node))
                    .variant(buttonVariant(node))
                    .build();
            case CARD -> CardIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .layout(node.getLayout())
                    .children(convertChildren(node.getChildren(), styleRefs))
                    .build();
            default -> ContainerIr.builder()
                    .id(node.getId()).name(node.getName()).boundingBox(box).styleRef(styleRef)
                    .layout(node.getLayout())
                    .children(convertChildren(node.getChildren(), styleRefs))
                    .build();
        };
    }

    private List<IrNode> convertChildren(List<LayoutNode> children, StyleRefGenerator styleRefs) {
        if (options.isGroupRepeaters() && children.size() >= 2) {
            return repeaterGrouper.group(children, child -> toIr(child, styleRefs), styleRefs);
        }
        return convertAll(children, styleRefs);
    }

    private List<IrNode> convertAll(List<LayoutNode> children, StyleRefGenerator styleRefs) {
        List<IrNode> result = new ArrayList<>(children.size());
        for (LayoutNode child : children) {
            result.add(toIr(child, styleRefs));
        }
        return result;
    }

    private String buttonLabel(LayoutNode node) {
        return node.getChildren().stream()
                .filter(predicates::isText)
                .map(LayoutNode::getText)
                .findFirst()
                .orElse("Button");
    }

    private String buttonIconRef(LayoutNode node) {
        return node.getChildren().stream()
                .filter(predicates::isIcon)
                .map(icon -> StyleRefGenerator.baseRef(icon.getName(), icon.getId(), SemanticType.ICON))
                .findFirst()
                .orElse(null);
    }

    /**
     * Outline: stroke without a visible solid fill. Ghost: a nearly transparent solid
     * fill. Anything else is primary.
     */
    ButtonVariant buttonVariant(LayoutNode node) {
        boolean hasStroke = !node.getVisuals().getStrokes().isEmpty();
        if (hasStroke && !predicates.hasVisibleSolidFill(node)) {
            return ButtonVariant.OUTLINE;
        }
        if (predicates.hasGhostFill(node)) {
            return ButtonVariant.GHOST;
        }
        return ButtonVariant.PRIMARY;
    }
}
