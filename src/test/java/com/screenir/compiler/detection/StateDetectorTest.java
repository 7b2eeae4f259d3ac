package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.model.raw.TypographyInfo;
import com.screenir.compiler.styles.DesignTokens;
import com.screenir.compiler.styles.ExtractedStyle;
import com.screenir.compiler.styles.StylesBundle;
import com.screenir.compiler.styles.TypographyStyle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.screenir.compiler.detection.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StateDetector.
 */
class StateDetectorTest {

    private static final String WHITE = "#FFFFFF";
    private static final String BLUE = "#3B82F6";
    private static final String RED = "#EF4444";
    private static final String INK = "#111827";

    private final StateDetector detector = new StateDetector();
    private final Map<String, ExtractedStyle> styles = new LinkedHashMap<>();

    @Test
    void testSingleOddInstanceIsBooleanState() {
        List<IrNode> tabs = List.of(
                tab("t1", "Tab", WHITE, INK),
                tab("t2", "Tab", WHITE, INK),
                tab("t3", "Tab", BLUE, INK),
                tab("t4", "Tab", WHITE, INK),
                tab("t5", "Tab", WHITE, INK));

        StateDetectionResult result = detector.detect(tabs, bundle());

        assertThat(result.hasSemanticState()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(0.9);
        SemanticState state = result.getState();
        assertThat(state.getType()).isEqualTo(StateType.SELECTED);
        assertThat(state.getPropName()).isEqualTo("isSelected");
        assertThat(state.getPropType()).isEqualTo(SemanticState.PropType.BOOLEAN);
        assertThat(state.getDefaultValue()).isEqualTo(false);
        assertThat(state.getInstanceStates())
                .containsEntry("t3", true)
                .containsEntry("t1", false)
                .hasSize(5);
        assertThat(state.getStateStyles().get("selected").getContainerStyles())
                .containsOnly(entry("backgroundColor", BLUE));
        assertThat(state.getStateStyles().get("default").getContainerStyles())
                .containsOnly(entry("backgroundColor", WHITE));
    }

    @Test
    void testStateNameComesFromOddLayerName() {
        List<IrNode> tabs = List.of(
                tab("t1", "Tab", WHITE, INK),
                tab("t2", "Tab Active", BLUE, INK),
                tab("t3", "Tab", WHITE, INK));

        SemanticState state = detector.detect(tabs, bundle()).getState();

        assertThat(state.getPropName()).isEqualTo("isActive");
        assertThat(state.getType()).isEqualTo(StateType.ACTIVE);
        assertThat(state.getStateStyles()).containsOnlyKeys("default", "active");
    }

    @Test
    void testKeywordMustBeWholeWord() {
        List<IrNode> items = List.of(
                tab("t1", "Coupon", WHITE, INK),
                tab("t2", "Coupon", BLUE, INK),
                tab("t3", "Coupon", WHITE, INK));

        assertThat(detector.detect(items, bundle()).getState().getPropName()).isEqualTo("isSelected");
    }

    @Test
    void testTextColorChangeIsReportedAsTextStyle() {
        List<IrNode> tabs = List.of(
                tab("t1", "Tab", WHITE, INK),
                tab("t2", "Tab", WHITE, BLUE),
                tab("t3", "Tab", WHITE, INK));

        SemanticState state = detector.detect(tabs, bundle()).getState();

        StateStyles selected = state.getStateStyles().get("selected");
        assertThat(selected.getContainerStyles()).isEmpty();
        assertThat(selected.getTextStyles()).containsOnly(entry("color", BLUE));
    }

    @Test
    void testChildContainerChangeIsReportedAsContainerStyle() {
        List<IrNode> tabs = List.of(
                pillTab("t1", WHITE),
                pillTab("t2", BLUE),
                pillTab("t3", WHITE),
                pillTab("t4", WHITE));

        SemanticState state = detector.detect(tabs, bundle()).getState();

        assertThat(state.getInstanceStates()).containsEntry("t2", true).containsEntry("t1", false);
        assertThat(state.getStateStyles().get("selected").getContainerStyles())
                .containsOnly(entry("backgroundColor", BLUE));
        assertThat(state.getStateStyles().get("selected").getTextStyles()).isEmpty();
    }

    @Test
    void testNearEvenSplitIsVariant() {
        List<IrNode> buttons = List.of(
                tab("b1", "Action", BLUE, WHITE),
                tab("b2", "Action", WHITE, BLUE),
                tab("b3", "Action", BLUE, WHITE),
                tab("b4", "Action", WHITE, BLUE),
                tab("b5", "Action", BLUE, WHITE));

        StateDetectionResult result = detector.detect(buttons, bundle());

        assertThat(result.getConfidence()).isEqualTo(0.7);
        SemanticState state = result.getState();
        assertThat(state.getType()).isEqualTo(StateType.VARIANT);
        assertThat(state.getPropName()).isEqualTo("variant");
        assertThat(state.getPropType()).isEqualTo(SemanticState.PropType.ENUM);
        assertThat(state.getDefaultValue()).isEqualTo("primary");
        assertThat(state.getInstanceStates())
                .containsEntry("b1", "primary")
                .containsEntry("b2", "secondary");
        assertThat(state.getStateStyles().get("secondary").getContainerStyles())
                .containsEntry("backgroundColor", WHITE);
    }

    @Test
    void testThreeFingerprintsAreNotState() {
        List<IrNode> items = List.of(
                tab("a", "Chip", BLUE, INK),
                tab("b", "Chip", RED, INK),
                tab("c", "Chip", WHITE, INK),
                tab("d", "Chip", WHITE, INK),
                tab("e", "Chip", WHITE, INK));

        StateDetectionResult result = detector.detect(items, bundle());

        assertThat(result.hasSemanticState()).isFalse();
        assertThat(result.getConfidence()).isZero();
    }

    @Test
    void testUnevenSplitIsNotState() {
        List<IrNode> items = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            items.add(tab("c" + i, "Chip", i < 2 ? BLUE : WHITE, INK));
        }

        assertThat(detector.detect(items, bundle()).hasSemanticState()).isFalse();
    }

    @Test
    void testUniformOrSingleInstanceIsNotState() {
        List<IrNode> same = List.of(tab("a", "Chip", WHITE, INK), tab("b", "Chip", WHITE, INK),
                tab("c", "Chip", WHITE, INK));

        assertThat(detector.detect(same, bundle()).hasSemanticState()).isFalse();
        assertThat(detector.detect(List.of(same.get(0)), bundle()).hasSemanticState()).isFalse();
    }

    @Test
    void testTextContentDoesNotSplitFingerprints() {
        IrNode first = card("x1", "Row", 300, 60, text("x1-t", "Alpha"));
        IrNode second = card("x2", "Row", 300, 60, text("x2-t", "Beta"));
        styles.put("x1", ExtractedStyle.builder().id("x1").backgroundColor(WHITE).build());
        styles.put("x2", ExtractedStyle.builder().id("x2").backgroundColor(WHITE).build());

        assertThat(StateDetector.fingerprint(first, bundle())).isEqualTo(StateDetector.fingerprint(second, bundle()));
    }

    private IrNode tab(String id, String name, String background, String textColor) {
        String textId = id + "-t";
        styles.put(id, ExtractedStyle.builder().id(id).backgroundColor(background).borderRadius(8.0).build());
        styles.put(textId, ExtractedStyle.builder()
                .id(textId)
                .typography(new TypographyStyle("Inter", 14, 400, 20, 0, TypographyInfo.TextAlign.LEFT, textColor))
                .build());
        return card(id, name, 80, 32, text(textId, name));
    }

    private IrNode pillTab(String id, String pillBackground) {
        String pillId = id + "-pill";
        styles.put(id, ExtractedStyle.builder().id(id).build());
        styles.put(pillId, ExtractedStyle.builder().id(pillId).backgroundColor(pillBackground).borderRadius(16.0).build());
        return card(id, "Tab", 80, 40, card(pillId, "Pill", 60, 32, text(id + "-t", "Tab")));
    }

    private StylesBundle bundle() {
        return new StylesBundle(styles, DesignTokens.empty());
    }
}
