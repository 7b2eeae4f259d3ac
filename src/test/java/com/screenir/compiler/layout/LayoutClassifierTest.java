package com.screenir.compiler.layout;

import com.screenir.compiler.model.LayoutHints;
import com.screenir.compiler.model.raw.AutoLayout;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.NodeType;
import com.screenir.compiler.model.raw.Padding;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.normalize.NormalizedNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayoutClassifier.
 */
class LayoutClassifierTest {

    private final LayoutClassifier classifier = new LayoutClassifier();

    @Test
    void testInfersRowWithModalGap() {
        NormalizedNode row = node("1", 0, 0, 300, 40)
                .child(node("a", 10, 10, 50, 20).build())
                .child(node("b", 70, 10, 50, 20).build())
                .child(node("c", 130, 10, 50, 20).build())
                .child(node("d", 195, 10, 50, 20).build())
                .build();

        LayoutMeta layout = classifier.addLayout(row).getLayout();

        assertThat(layout.getType()).isEqualTo(LayoutType.ROW);
        assertThat(layout.getGap()).isEqualTo(10);
        assertThat(layout.getPadding()).isEqualTo(new Padding(10, 55, 10, 10));
        assertThat(layout.getCrossAlign()).isEqualTo(CrossAlign.CENTER);
    }

    @Test
    void testInfersColumnAndMedianGap() {
        NormalizedNode column = node("1", 0, 0, 100, 300)
                .child(node("a", 0, 0, 100, 40).build())
                .child(node("b", 0, 50, 100, 40).build())
                .child(node("c", 0, 110, 100, 40).build())
                .build();

        LayoutMeta layout = classifier.addLayout(column).getLayout();

        assertThat(layout.getType()).isEqualTo(LayoutType.COLUMN);
        assertThat(layout.getGap()).isEqualTo(15);
    }

    @Test
    void testOverlappingChildrenFormStack() {
        NormalizedNode stack = node("1", 0, 0, 200, 200)
                .child(node("bg", 0, 0, 200, 200).build())
                .child(node("fg", 20, 20, 160, 160).build())
                .build();

        assertThat(classifier.addLayout(stack).getLayout().getType()).isEqualTo(LayoutType.STACK);
    }

    @Test
    void testLeafIsAbsoluteAndSingleChildIsColumn() {
        NormalizedNode leaf = node("1", 0, 0, 10, 10).build();
        NormalizedNode parent = node("2", 0, 0, 100, 100)
                .child(node("3", 10, 10, 20, 20).build())
                .build();

        assertThat(classifier.addLayout(leaf).getLayout().getType()).isEqualTo(LayoutType.ABSOLUTE);
        assertThat(classifier.addLayout(parent).getLayout().getType()).isEqualTo(LayoutType.COLUMN);
    }

    @Test
    void testAutoLayoutIsTrusted() {
        AutoLayout autoLayout = AutoLayout.builder()
                .direction(AutoLayout.Direction.HORIZONTAL)
                .gap(8)
                .padding(new Padding(4, 4, 4, 4))
                .primaryAlign(AutoLayout.PrimaryAlign.SPACE_BETWEEN)
                .counterAlign(AutoLayout.CounterAlign.CENTER)
                .build();
        // children stacked vertically, but the declaration wins
        NormalizedNode node = node("1", 0, 0, 200, 200)
                .layoutHints(LayoutHints.builder().autoLayout(autoLayout).build())
                .child(node("a", 0, 0, 50, 50).build())
                .child(node("b", 0, 100, 50, 50).build())
                .build();

        LayoutMeta layout = classifier.addLayout(node).getLayout();

        assertThat(layout.getType()).isEqualTo(LayoutType.ROW);
        assertThat(layout.getGap()).isEqualTo(8);
        assertThat(layout.getMainAlign()).isEqualTo(MainAlign.SPACE_BETWEEN);
        assertThat(layout.getCrossAlign()).isEqualTo(CrossAlign.CENTER);
    }

    @Test
    void testFlexGrowDependsOnParentAxis() {
        AutoLayout horizontal = AutoLayout.builder().direction(AutoLayout.Direction.HORIZONTAL).build();
        NormalizedNode parent = node("1", 0, 0, 300, 50)
                .layoutHints(LayoutHints.builder().autoLayout(horizontal).build())
                .child(node("a", 0, 0, 100, 50)
                        .layoutHints(LayoutHints.builder().layoutGrow(1).build())
                        .build())
                .child(node("b", 100, 0, 100, 50)
                        .layoutHints(LayoutHints.builder().layoutAlign(RawNode.LayoutAlign.STRETCH).build())
                        .build())
                .build();

        LayoutNode result = classifier.addLayout(parent);

        LayoutMeta grow = result.getChildren().get(0).getLayout();
        LayoutMeta stretch = result.getChildren().get(1).getLayout();
        assertThat(grow.getHorizontalSizing()).isEqualTo(Sizing.FILL);
        assertThat(grow.getVerticalSizing()).isEqualTo(Sizing.FIXED);
        assertThat(stretch.getVerticalSizing()).isEqualTo(Sizing.FILL);
    }

    @Test
    void testScrollableOverflow() {
        NormalizedNode node = node("1", 0, 0, 300, 50)
                .layoutHints(LayoutHints.builder()
                        .overflowDirection(RawNode.OverflowDirection.HORIZONTAL_SCROLLING)
                        .build())
                .build();

        assertThat(classifier.addLayout(node).getLayout().isScrollable()).isTrue();
    }

    @Test
    void testMissingGeometryBecomesZeroBox() {
        NormalizedNode node = NormalizedNode.builder().id("1").name("Ghost").type(NodeType.FRAME).build();

        assertThat(classifier.addLayout(node).getBoundingBox()).isEqualTo(BoundingBox.ZERO);
    }

    private static NormalizedNode.NormalizedNodeBuilder node(String id, double x, double y, double w, double h) {
        return NormalizedNode.builder()
                .id(id)
                .name("Node " + id)
                .type(NodeType.FRAME)
                .boundingBox(new BoundingBox(x, y, w, h));
    }
}
