package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.RepeaterIr;
import com.screenir.compiler.model.raw.BoundingBox;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.screenir.compiler.detection.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ListDetector.
 */
class ListDetectorTest {

    private final ListDetector detector = new ListDetector();

    @Test
    void testThreeAlikeCardsFormVerticalList() {
        IrNode root = container("root", "Screen", COLUMN,
                container("list", "ProductList", COLUMN,
                        productCard("c1", "Mouse", "$25"),
                        productCard("c2", "Keyboard", "$49"),
                        productCard("c3", "Monitor", "$199")));

        List<ListHint> hints = detector.detectLists(root);

        assertThat(hints).hasSize(1);
        ListHint hint = hints.get(0);
        assertThat(hint.getContainerId()).isEqualTo("list");
        assertThat(hint.getItemIds()).containsExactly("c1", "c2", "c3");
        assertThat(hint.getOrientation()).isEqualTo(Orientation.VERTICAL);
        assertThat(hint.getItemType()).isEqualTo("ProductCardItem");
    }

    @Test
    void testTwoItemsAreNotEnoughUnlessScrollable() {
        IrNode plain = container("list", "Chips", ROW,
                productCard("c1", "A", "1"), productCard("c2", "B", "2"));
        IrNode scrolling = container("list", "Chips", SCROLL_ROW,
                productCard("c1", "A", "1"), productCard("c2", "B", "2"));

        assertThat(detector.detectLists(plain)).isEmpty();
        assertThat(detector.detectLists(scrolling)).singleElement()
                .extracting(ListHint::getOrientation)
                .isEqualTo(Orientation.HORIZONTAL);
    }

    @Test
    void testDifferentStructureIsNotList() {
        IrNode root = container("list", "Feed", COLUMN,
                productCard("c1", "A", "1"),
                productCard("c2", "B", "2"),
                card("c3", "ProductCard", 343, 120, text("c3-t", "C")));

        assertThat(detector.detectLists(root)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "110, 100, true",
            "90, 100, true",
            "111, 100, false",
            "100, 89, false",
            "0, 0, true"
    })
    void testSizeTolerance(double width, double height, boolean similar) {
        BoundingBox reference = new BoundingBox(0, 0, 100, 100);
        if (width == 0) {
            reference = BoundingBox.ZERO;
        }

        assertThat(ListDetector.hasSimilarSize(new BoundingBox(0, 0, width, height), reference)).isEqualTo(similar);
    }

    @Test
    void testItemOutsideToleranceBreaksList() {
        IrNode root = container("list", "Grid", COLUMN,
                card("c1", "Tile", 100, 100, text("t1", "a")),
                card("c2", "Tile", 110, 100, text("t2", "b")),
                card("c3", "Tile", 111, 100, text("t3", "c")));

        assertThat(detector.detectLists(root)).isEmpty();
    }

    @Test
    void testGenericItemNamesFallBackToRoleAndHash() {
        IrNode root = container("list", "Frame 9", COLUMN,
                card("c1", "Frame 1", 100, 100, text("t1", "a")),
                card("c2", "Frame 2", 100, 100, text("t2", "b")),
                card("c3", "Frame 3", 100, 100, text("t3", "c")));

        String itemType = detector.detectLists(root).get(0).getItemType();

        assertThat(itemType).startsWith("CardItem").hasSizeGreaterThan("CardItem".length());
    }

    @Test
    void testItemsOfDetectedListAreNotSearched() {
        IrNode root = container("outer", "Sections", COLUMN, section("1"), section("2"), section("3"));

        List<ListHint> hints = detector.detectLists(root);

        assertThat(hints).extracting(ListHint::getContainerId).containsExactly("outer");
    }

    @Test
    void testNestedListIsFoundBelowNonList() {
        IrNode root = container("root", "Screen", COLUMN,
                text("title", "Products"),
                container("list", "Results", COLUMN,
                        productCard("c1", "A", "1"),
                        productCard("c2", "B", "2"),
                        productCard("c3", "C", "3")));

        assertThat(detector.detectLists(root)).extracting(ListHint::getContainerId).containsExactly("list");
    }

    @Test
    void testRepeaterChildrenAreNotSearched() {
        IrNode repeater = RepeaterIr.builder()
                .id("repeater_1")
                .name("Rows")
                .boundingBox(new BoundingBox(0, 0, 343, 300))
                .styleRef("repeater_1")
                .itemComponentName("RowItem")
                .dataPropName("rows")
                .layout(COLUMN)
                .child(section("1"))
                .build();
        IrNode root = container("root", "Screen", COLUMN, text("title", "Rows"), repeater);

        assertThat(detector.detectLists(root)).isEmpty();
        assertThat(detector.detectLists(container("root", "Screen", COLUMN, text("title", "Rows"), section("1"))))
                .extracting(ListHint::getContainerId)
                .containsExactly("rows1");
    }

    private static IrNode section(String n) {
        return container("s" + n, "Section", COLUMN,
                container("rows" + n, "Rows", COLUMN, text(n + "a", "a"), text(n + "b", "b"), text(n + "c", "c")));
    }
}
