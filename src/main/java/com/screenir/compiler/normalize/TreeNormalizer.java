package com.screenir.compiler.normalize;

import com.screenir.compiler.exception.InvalidDesignTreeException;
import com.screenir.compiler.model.LayoutHints;
import com.screenir.compiler.model.VisualProperties;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.RawNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * First pipeline stage: filters hidden, design-only and device-chrome nodes out of
 * the raw tree and collapses useless wrapper groups.
 */
public class TreeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TreeNormalizer.class);

    static final String CIRCULAR_PREFIX = "[Circular: ";
    static final String CIRCULAR_ID_SUFFIX = ":circular";

    private final NodeFilter nodeFilter;
    private final SafeAreaDetector safeAreaDetector;
    private final GroupUnwrapper unwrapper;

    public TreeNormalizer() {
        this(new NodeFilter(), new SafeAreaDetector(), new GroupUnwrapper());
    }

    public TreeNormalizer(NodeFilter nodeFilter, SafeAreaDetector safeAreaDetector, GroupUnwrapper unwrapper) {
        this.nodeFilter = nodeFilter;
        this.safeAreaDetector = safeAreaDetector;
        this.unwrapper = unwrapper;
    }

    /**
     * @return the normalized tree, or empty when the root itself is filtered
     * @throws InvalidDesignTreeException if a node has no id
     */
    public Optional<NormalizedNode> normalize(RawNode root, Conventions conventions) {
        SafeAreaDetection safeArea = safeAreaDetector.detect(root, conventions);
        return normalize(root, conventions, safeArea.getExcludeIds());
    }

    /**
     * Normalizes with an explicit set of node ids to drop (typically chrome found by
     * {@link SafeAreaDetector}).
     */
    public Optional<NormalizedNode> normalize(RawNode root, Conventions conventions, Set<String> excludeIds) {
        Optional<NormalizedNode> filtered = filter(root, conventions, excludeIds, new HashSet<>());
        if (filtered.isEmpty()) {
            log.debug("Root node '{}' was filtered, nothing to normalize", root.getName());
            return Optional.empty();
        }

        NormalizedNode result = unwrapper.unwrapUselessGroups(filtered.get());
        if (conventions.isFlattenWrapperGroups()) {
            result = flattenChildren(result);
        }
        log.debug("Normalized '{}': {} node(s)", root.getName(), result.countNodes());
        return Optional.of(result);
    }

    private Optional<NormalizedNode> filter(RawNode node, Conventions conventions, Set<String> excludeIds,
                                            Set<String> visited) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            throw new InvalidDesignTreeException("Node '" + node.getName() + "' has no id");
        }
        if (excludeIds.contains(id)) {
            log.debug("Filtered '{}' ({}): {}", node.getName(), id, FilterReason.OS_COMPONENT);
            return Optional.empty();
        }

        Optional<FilterReason> reason = nodeFilter.filterReason(node, conventions);
        if (reason.isPresent()) {
            log.debug("Filtered '{}' ({}): {}", node.getName(), id, reason.get());
            return Optional.empty();
        }

        if (!visited.add(id)) {
            log.warn("Node id {} reached twice, replacing with a placeholder", id);
            return Optional.of(circularPlaceholder(node));
        }

        NormalizedNode.NormalizedNodeBuilder builder = NormalizedNode.builder()
                .id(id)
                .name(node.getName())
                .type(node.getType())
                .boundingBox(node.getBoundingBox())
                .visuals(VisualProperties.of(node))
                .layoutHints(LayoutHints.of(node))
                .text(node.getCharacters())
                .componentId(node.getComponentId());

        for (RawNode child : node.getChildren()) {
            filter(child, conventions, excludeIds, visited).ifPresent(builder::child);
        }
        return Optional.of(builder.build());
    }

    private NormalizedNode circularPlaceholder(RawNode node) {
        return NormalizedNode.builder()
                .id(node.getId() + CIRCULAR_ID_SUFFIX)
                .name(CIRCULAR_PREFIX + node.getName() + "]")
                .type(node.getType())
                .boundingBox(BoundingBox.ZERO)
                .build();
    }

    private NormalizedNode flattenChildren(NormalizedNode node) {
        return node.toBuilder()
                .clearChildren()
                .children(unwrapper.flattenWrapperGroups(node.getChildren()))
                .build();
    }
}
