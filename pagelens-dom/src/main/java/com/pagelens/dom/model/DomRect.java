package com.pagelens.dom.model;

/**
 * Axis-aligned rectangle in CSS pixels, as reported by the layout snapshot.
 */
public record DomRect(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    /**
     * Area of the overlap between this rectangle and {@code other}; 0 when
     * they are disjoint or only touch.
     */
    public double intersectionArea(DomRect other) {
        double xOverlap = Math.max(0, Math.min(right(), other.right()) - Math.max(x, other.x));
        double yOverlap = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
        return xOverlap * yOverlap;
    }

    /**
     * Fraction of this rectangle's area that lies inside {@code container}.
     * A zero-area rectangle has ratio 0 so it is never treated as contained.
     */
    public double containmentRatio(DomRect container) {
        double area = area();
        if (area == 0) {
            return 0;
        }
        return intersectionArea(container) / area;
    }
}
