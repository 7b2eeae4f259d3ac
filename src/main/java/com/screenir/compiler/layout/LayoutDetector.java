package com.screenir.compiler.layout;

import com.screenir.compiler.model.raw.BoundingBox;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Infers a layout type and spacing from the geometry of a node's children.
 */
public class LayoutDetector {

    /**
     * Allowed overlap between consecutive children on the main axis.
     */
    static final double OVERLAP_TOLERANCE = 2;

    /**
     * Allowed spread of child positions on the cross axis.
     */
    static final double CROSS_AXIS_TOLERANCE = OVERLAP_TOLERANCE + 20;

    static final double STACK_OVERLAP_RATIO = 0.5;

    public LayoutType detect(List<BoundingBox> children) {
        if (children.isEmpty()) {
            return LayoutType.ABSOLUTE;
        }
        if (children.size() == 1) {
            return LayoutType.COLUMN;
        }
        if (isStack(children)) {
            return LayoutType.STACK;
        }
        if (isRow(children)) {
            return LayoutType.ROW;
        }
        if (isColumn(children)) {
            return LayoutType.COLUMN;
        }
        return LayoutType.ABSOLUTE;
    }

    public boolean isRow(List<BoundingBox> children) {
        return isFlow(children, BoundingBox::getX, BoundingBox::getRight, BoundingBox::getY);
    }

    public boolean isColumn(List<BoundingBox> children) {
        return isFlow(children, BoundingBox::getY, BoundingBox::getBottom, BoundingBox::getX);
    }

    /**
     * True when some pair of children overlaps by more than half of the smaller one's area.
     */
    public boolean isStack(List<BoundingBox> children) {
        if (children.size() < 2) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            for (int j = i + 1; j < children.size(); j++) {
                BoundingBox a = children.get(i);
                BoundingBox b = children.get(j);
                double overlapX = Math.max(0, Math.min(a.getRight(), b.getRight()) - Math.max(a.getX(), b.getX()));
                double overlapY = Math.max(0, Math.min(a.getBottom(), b.getBottom()) - Math.max(a.getY(), b.getY()));
                double smallerArea = Math.min(a.getArea(), b.getArea());
                if (overlapX * overlapY > smallerArea * STACK_OVERLAP_RATIO) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Spacing between consecutive children along the axis: the rounded gap that occurs
     * most often (at least twice, strictly more than any other), else the median.
     */
    public double gap(List<BoundingBox> children, LayoutType type) {
        if (children.size() < 2 || !type.isFlow()) {
            return 0;
        }
        ToDoubleFunction<BoundingBox> start = type == LayoutType.ROW ? BoundingBox::getX : BoundingBox::getY;
        ToDoubleFunction<BoundingBox> end = type == LayoutType.ROW ? BoundingBox::getRight : BoundingBox::getBottom;

        List<BoundingBox> sorted = sortedBy(children, start);
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            gaps.add(Math.max(0, start.applyAsDouble(sorted.get(i)) - end.applyAsDouble(sorted.get(i - 1))));
        }

        Map<Long, Integer> counts = new LinkedHashMap<>();
        for (double g : gaps) {
            counts.merge(Math.round(g), 1, Integer::sum);
        }
        long mode = 0;
        int best = 0;
        boolean unique = false;
        for (Map.Entry<Long, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                mode = entry.getKey();
                best = entry.getValue();
                unique = true;
            } else if (entry.getValue() == best) {
                unique = false;
            }
        }
        if (unique && best >= 2) {
            return mode;
        }

        List<Double> sortedGaps = new ArrayList<>(gaps);
        sortedGaps.sort(Comparator.naturalOrder());
        int mid = sortedGaps.size() / 2;
        double median = sortedGaps.size() % 2 == 1
                ? sortedGaps.get(mid)
                : (sortedGaps.get(mid - 1) + sortedGaps.get(mid)) / 2;
        return Math.round(median);
    }

    private boolean isFlow(List<BoundingBox> children,
                           ToDoubleFunction<BoundingBox> mainStart,
                           ToDoubleFunction<BoundingBox> mainEnd,
                           ToDoubleFunction<BoundingBox> crossStart) {
        if (children.size() < 2) {
            return false;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (BoundingBox box : children) {
            min = Math.min(min, crossStart.applyAsDouble(box));
            max = Math.max(max, crossStart.applyAsDouble(box));
        }
        if (max - min > CROSS_AXIS_TOLERANCE) {
            return false;
        }

        List<BoundingBox> sorted = sortedBy(children, mainStart);
        for (int i = 1; i < sorted.size(); i++) {
            double previousEnd = mainEnd.applyAsDouble(sorted.get(i - 1));
            if (mainStart.applyAsDouble(sorted.get(i)) < previousEnd - OVERLAP_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static List<BoundingBox> sortedBy(List<BoundingBox> boxes, ToDoubleFunction<BoundingBox> key) {
        List<BoundingBox> sorted = new ArrayList<>(boxes);
        sorted.sort(Comparator.comparingDouble(key));
        return sorted;
    }
}
