package com.screenir.compiler.normalize;

import com.screenir.compiler.exception.InvalidDesignTreeException;
import com.screenir.compiler.model.raw.Fill;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.model.raw.RgbaColor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.screenir.compiler.DesignFixtures.frame;
import static com.screenir.compiler.DesignFixtures.group;
import static com.screenir.compiler.DesignFixtures.text;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TreeNormalizer.
 */
class TreeNormalizerTest {

    private final TreeNormalizer normalizer = new TreeNormalizer();

    @Test
    void testDropsHiddenNodes() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(text("2", "Visible", 0, 100, 100, 20, "Hello"))
                .child(frame("3", "Hidden", 0, 200, 100, 20).visible(false).build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("2");
    }

    @Test
    void testDropsDesignOnlyLayersByName() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame("2", "Redline Notes", 0, 100, 100, 20).build())
                .child(frame("3", "_scratch", 0, 200, 100, 20).build())
                .child(frame("4", "Content", 0, 300, 100, 20).build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("4");
    }

    @Test
    void testCustomIgnorePatternsReplaceDefaults() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame("2", "Redline Notes", 0, 100, 100, 20).build())
                .child(frame("3", "Debug Overlay", 0, 200, 100, 20).build())
                .build();

        Conventions conventions = Conventions.defaults().withIgnorePatterns(List.of("debug*"));
        NormalizedNode result = normalizer.normalize(root, conventions).orElseThrow();

        assertThat(childIds(result)).containsExactly("2");
    }

    @Test
    void testDropsNamedDeviceChromeAnywhere() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame("2", "Header", 0, 0, 375, 100)
                        .child(frame("3", "Status Bar", 0, 0, 375, 44).build())
                        .child(text("4", "Heading", 16, 60, 200, 30, "Inbox"))
                        .build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result.getChildren().get(0))).containsExactly("4");
    }

    @Test
    void testDropsUnnamedStatusBarByGeometry() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame("2", "Rectangle 7", 0, 0, 375, 44).build())
                .child(frame("3", "Body", 0, 44, 375, 700).build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("3");
    }

    @Test
    void testFilteredRootYieldsEmpty() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812).visible(false).build();

        Optional<NormalizedNode> result = normalizer.normalize(root, Conventions.defaults());

        assertThat(result).isEmpty();
    }

    @Test
    void testUnwrapsNestedSingleChildGroupsInOnePass() {
        RawNode leaf = text("4", "Label", 10, 10, 80, 20, "Deep");
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(group("2", "Group 1", 10, 10, 80, 20)
                        .child(group("3", "Group 2", 10, 10, 80, 20)
                                .child(leaf)
                                .build())
                        .build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("4");
        assertThat(result.getChildren().get(0).getText()).isEqualTo("Deep");
    }

    @Test
    void testKeepsGroupsWithVisualTreatment() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(group("2", "Badge", 10, 10, 80, 20)
                        .fill(Fill.solid(RgbaColor.BLACK))
                        .child(text("3", "Count", 10, 10, 80, 20, "3"))
                        .build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("2");
    }

    @Test
    void testFramesAreNeverUnwrapped() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame("2", "Wrapper", 10, 10, 80, 20)
                        .child(text("3", "Label", 10, 10, 80, 20, "Kept"))
                        .build())
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("2");
    }

    @Test
    void testFlattenWrapperGroupsHoistsChildren() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(group("2", "Group 5", 0, 0, 200, 100)
                        .child(text("3", "A", 0, 0, 50, 20, "a"))
                        .child(text("4", "B", 0, 40, 50, 20, "b"))
                        .build())
                .build();

        Conventions conventions = Conventions.defaults().toBuilder().flattenWrapperGroups(true).build();
        NormalizedNode flattened = normalizer.normalize(root, conventions).orElseThrow();
        NormalizedNode kept = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(flattened)).containsExactly("3", "4");
        assertThat(childIds(kept)).containsExactly("2");
    }

    @Test
    void testMissingIdIsRejected() {
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(frame(null, "Orphan", 0, 0, 10, 10).build())
                .build();

        assertThatThrownBy(() -> normalizer.normalize(root, Conventions.defaults()))
                .isInstanceOf(InvalidDesignTreeException.class)
                .hasMessageContaining("Orphan");
    }

    @Test
    void testRepeatedIdBecomesPlaceholder() {
        RawNode shared = text("2", "Label", 0, 0, 50, 20, "x");
        RawNode root = frame("1", "Screen", 0, 0, 375, 812)
                .child(shared)
                .child(shared)
                .build();

        NormalizedNode result = normalizer.normalize(root, Conventions.defaults()).orElseThrow();

        assertThat(childIds(result)).containsExactly("2", "2:circular");
        assertThat(result.getChildren().get(1).getName()).isEqualTo("[Circular: Label]");
    }

    private static List<String> childIds(NormalizedNode node) {
        return node.getChildren().stream().map(NormalizedNode::getId).collect(Collectors.toList());
    }
}
