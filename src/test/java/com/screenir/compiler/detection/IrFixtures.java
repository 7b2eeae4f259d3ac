package com.screenir.compiler.detection;

import com.screenir.compiler.ir.ButtonIr;
import com.screenir.compiler.ir.ButtonVariant;
import com.screenir.compiler.ir.CardIr;
import com.screenir.compiler.ir.ContainerIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.TextIr;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutType;
import com.screenir.compiler.layout.Overflow;
import com.screenir.compiler.model.raw.BoundingBox;

import java.util.List;

/**
 * Hand-built IR trees for the detector tests. Style refs equal node ids.
 */
final class IrFixtures {

    static final LayoutMeta COLUMN = LayoutMeta.builder().type(LayoutType.COLUMN).build();
    static final LayoutMeta ROW = LayoutMeta.builder().type(LayoutType.ROW).build();
    static final LayoutMeta SCROLL_ROW = ROW.toBuilder().overflow(Overflow.SCROLL).build();

    private IrFixtures() {
    }

    static TextIr text(String id, String value) {
        return TextIr.builder()
                .id(id)
                .name("Label")
                .boundingBox(new BoundingBox(0, 0, 100, 20))
                .styleRef(id)
                .text(value)
                .build();
    }

    static CardIr card(String id, String name, double width, double height, IrNode... children) {
        return CardIr.builder()
                .id(id)
                .name(name)
                .boundingBox(new BoundingBox(0, 0, width, height))
                .styleRef(id)
                .layout(COLUMN)
                .children(List.of(children))
                .build();
    }

    static ContainerIr container(String id, String name, LayoutMeta layout, IrNode... children) {
        return ContainerIr.builder()
                .id(id)
                .name(name)
                .boundingBox(new BoundingBox(0, 0, 375, 800))
                .styleRef(id)
                .layout(layout)
                .children(List.of(children))
                .build();
    }

    static ButtonIr button(String id, String name, String label) {
        return ButtonIr.builder()
                .id(id)
                .name(name)
                .boundingBox(new BoundingBox(0, 0, 120, 44))
                .styleRef(id)
                .label(label)
                .variant(ButtonVariant.PRIMARY)
                .build();
    }

    /**
     * A product card: title and price.
     */
    static CardIr productCard(String id, String title, String price) {
        return card(id, "ProductCard", 343, 120, text(id + "-t", title), text(id + "-p", price));
    }
}
