package com.pagelens.dom.model;

/**
 * Scroll position of a scrollable element, derived from its scroll and
 * client rectangles.
 */
public record ScrollInfo(
        double scrollTop,
        double scrollLeft,
        double scrollableHeight,
        double scrollableWidth,
        double visibleHeight,
        double visibleWidth,
        double contentAbove,
        double contentBelow,
        double pagesAbove,
        double pagesBelow,
        double horizontalScrollPercentage) {

    public boolean hasVerticalOverflow() {
        return scrollableHeight > visibleHeight;
    }

    public boolean hasHorizontalOverflow() {
        return scrollableWidth > visibleWidth;
    }

    static ScrollInfo of(DomRect scrollRects, DomRect clientRects) {
        double scrollTop = scrollRects.y();
        double scrollLeft = scrollRects.x();
        double scrollableHeight = scrollRects.height();
        double scrollableWidth = scrollRects.width();
        double visibleHeight = clientRects.height();
        double visibleWidth = clientRects.width();

        double contentAbove = Math.max(0, scrollTop);
        double contentBelow = Math.max(0, scrollableHeight - visibleHeight - scrollTop);
        double pagesAbove = visibleHeight > 0 ? contentAbove / visibleHeight : 0;
        double pagesBelow = visibleHeight > 0 ? contentBelow / visibleHeight : 0;

        double horizontalRange = scrollableWidth - visibleWidth;
        double horizontalPct = horizontalRange > 0
                ? Math.min(100, Math.max(0, scrollLeft / horizontalRange * 100))
                : 0;

        return new ScrollInfo(scrollTop, scrollLeft, scrollableHeight, scrollableWidth,
                visibleHeight, visibleWidth, contentAbove, contentBelow,
                pagesAbove, pagesBelow, horizontalPct);
    }
}
