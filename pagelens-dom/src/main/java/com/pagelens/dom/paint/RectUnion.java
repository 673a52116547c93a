package com.pagelens.dom.paint;

import com.pagelens.dom.model.DomRect;

import java.util.ArrayList;
import java.util.List;

/**
 * Union of axis-aligned rectangles kept as a set of pairwise disjoint
 * rectangles. Adding a rectangle stores only the parts not yet covered.
 */
public class RectUnion {

    record Box(double x1, double y1, double x2, double y2) {

        static Box of(DomRect rect) {
            return new Box(rect.x(), rect.y(), rect.right(), rect.bottom());
        }

        boolean isEmpty() {
            return x2 <= x1 || y2 <= y1;
        }

        boolean intersects(Box other) {
            return x1 < other.x2 && other.x1 < x2 && y1 < other.y2 && other.y1 < y2;
        }

        /**
         * This box minus {@code other}, as up to four disjoint boxes.
         */
        List<Box> subtract(Box other) {
            List<Box> parts = new ArrayList<>(4);
            if (!intersects(other)) {
                parts.add(this);
                return parts;
            }
            double ix1 = Math.max(x1, other.x1);
            double iy1 = Math.max(y1, other.y1);
            double ix2 = Math.min(x2, other.x2);
            double iy2 = Math.min(y2, other.y2);
            addIfNonEmpty(parts, new Box(x1, y1, x2, iy1));   // above
            addIfNonEmpty(parts, new Box(x1, iy2, x2, y2));   // below
            addIfNonEmpty(parts, new Box(x1, iy1, ix1, iy2)); // left
            addIfNonEmpty(parts, new Box(ix2, iy1, x2, iy2)); // right
            return parts;
        }

        private static void addIfNonEmpty(List<Box> parts, Box box) {
            if (!box.isEmpty()) {
                parts.add(box);
            }
        }
    }

    private final List<Box> boxes = new ArrayList<>();

    /**
     * True when {@code rect} is completely covered by the union.
     */
    public boolean contains(DomRect rect) {
        Box candidate = Box.of(rect);
        if (candidate.isEmpty()) {
            return false;
        }
        return remainderOf(candidate).isEmpty();
    }

    /**
     * Add {@code rect}; returns false when it was already fully covered.
     */
    public boolean add(DomRect rect) {
        Box candidate = Box.of(rect);
        if (candidate.isEmpty()) {
            return false;
        }
        List<Box> uncovered = remainderOf(candidate);
        boxes.addAll(uncovered);
        return !uncovered.isEmpty();
    }

    public int size() {
        return boxes.size();
    }

    private List<Box> remainderOf(Box candidate) {
        List<Box> remaining = new ArrayList<>();
        remaining.add(candidate);
        for (Box existing : boxes) {
            List<Box> next = new ArrayList<>();
            for (Box piece : remaining) {
                next.addAll(piece.subtract(existing));
            }
            remaining = next;
            if (remaining.isEmpty()) {
                break;
            }
        }
        return remaining;
    }
}
