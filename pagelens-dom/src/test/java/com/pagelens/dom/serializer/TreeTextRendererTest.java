package com.pagelens.dom.serializer;

import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.RawNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pagelens.dom.DomFixtures.*;
import static com.pagelens.dom.serializer.ContainmentFilterTest.node;
import static org.junit.jupiter.api.Assertions.*;

class TreeTextRendererTest {

    private static final List<String> DEFAULTS = DomConstants.DEFAULT_INCLUDE_ATTRIBUTES;

    @Test
    void interactiveElement_withTextChild() {
        SimplifiedNode button = interactive(node(element("button", 7, rect(0, 0, 10, 10)), node(text("Save"))));

        assertEquals("[7]<button />\n\tSave", TreeTextRenderer.render(button, DEFAULTS));
    }

    @Test
    void newElement_getsStarMarker() {
        SimplifiedNode button = interactive(node(element("button", 8, rect(0, 0, 10, 10))));
        button.setNew(true);

        assertEquals("*[8]<button />", TreeTextRenderer.render(button, DEFAULTS));
    }

    @Test
    void nonInteractiveWrappers_areTransparent() {
        SimplifiedNode body = node(element("body", 1, rect(0, 0, 100, 100)),
                node(element("div", 2, rect(0, 0, 100, 100)), node(text("Plain text"))));

        assertEquals("Plain text", TreeTextRenderer.render(body, DEFAULTS));
    }

    @Test
    void closedShadowRoot_hasHeaderAndEndLine() {
        RawNode host = element("my-widget", 5, rect(0, 0, 10, 10));
        SimplifiedNode fragment = node(shadowRoot("closed"),
                interactive(node(element("button", 6, rect(0, 0, 10, 10)))));
        SimplifiedNode hostNode = interactive(node(host, fragment));
        hostNode.setShadowHost(true);

        assertEquals("|SHADOW(closed)|[5]<my-widget />\n\tClosed Shadow\n\t\t[6]<button />\n\tShadow End",
                TreeTextRenderer.render(hostNode, DEFAULTS));
    }

    @Test
    void openShadowRoot_hostGetsOpenMarker() {
        RawNode host = element("my-widget", 5, rect(0, 0, 10, 10));
        SimplifiedNode fragment = node(shadowRoot("open"),
                interactive(node(element("button", 6, rect(0, 0, 10, 10)))));
        SimplifiedNode hostNode = interactive(node(host, fragment));
        hostNode.setShadowHost(true);

        assertEquals("|SHADOW(open)|[5]<my-widget />\n\tOpen Shadow\n\t\t[6]<button />\n\tShadow End",
                TreeTextRenderer.render(hostNode, DEFAULTS));
    }

    @Test
    void emptyOpenShadowRoot_hasNoEndLine() {
        SimplifiedNode fragment = node(shadowRoot("open"));

        assertEquals("Open Shadow", TreeTextRenderer.render(fragment, DEFAULTS));
    }

    @Test
    void svg_isCollapsedToOneLine() {
        SimplifiedNode svg = interactive(node(attr(element("svg", 9, rect(0, 0, 10, 10)), "aria-label", "Logo"),
                node(text("inner text"))));

        assertEquals("[9]<svg aria-label=Logo /> <!-- SVG content collapsed -->",
                TreeTextRenderer.render(svg, DEFAULTS));
    }

    @Test
    void nonInteractiveFrames_getFrameMarkers() {
        SimplifiedNode iframe = node(element("iframe", 3, rect(0, 0, 50, 50)), node(text("Inside frame")));
        SimplifiedNode frame = node(element("frame", 4, rect(0, 0, 50, 50)));

        assertEquals("|IFRAME|<iframe />\n\tInside frame", TreeTextRenderer.render(iframe, DEFAULTS));
        assertEquals("|FRAME|<frame />", TreeTextRenderer.render(frame, DEFAULTS));
    }

    @Test
    void excludedAndHiddenNodes_passThroughToChildren() {
        SimplifiedNode excluded = node(element("span", 2, rect(0, 0, 10, 10)), node(text("Label")));
        excluded.setExcludedByParent(true);
        excluded.setInteractive(true);
        SimplifiedNode notDisplayed = node(element("div", 3, rect(0, 0, 10, 10)), node(text("Other")));
        notDisplayed.setShouldDisplay(false);
        notDisplayed.setInteractive(true);
        SimplifiedNode link = interactive(node(element("a", 1, rect(0, 0, 100, 20)), excluded, notDisplayed));

        assertEquals("[1]<a />\n\tLabel\n\tOther", TreeTextRenderer.render(link, DEFAULTS));
    }

    @Test
    void scrollContainer_withoutIndex() {
        RawNode panel = scrollable(element("div", 2, rect(0, 0, 100, 100)), 300, 100);
        SimplifiedNode panelNode = node(panel, interactive(node(element("button", 3, rect(0, 0, 10, 10)))));

        assertEquals("|SCROLL|<div /> (1.0 pages above, 1.0 pages below)\n\t[3]<button />",
                TreeTextRenderer.render(panelNode, DEFAULTS));
    }

    @Test
    void interactiveScrollContainer_getsScrollIndex() {
        RawNode panel = scrollable(element("div", 2, rect(0, 0, 100, 100)), 300, 0);
        SimplifiedNode panelNode = interactive(node(panel));

        assertEquals("|SCROLL[2]<div /> (0.0 pages above, 2.0 pages below)",
                TreeTextRenderer.render(panelNode, DEFAULTS));
    }

    @Test
    void nestedScrollContainer_isBracketedWithoutScrollMarker() {
        RawNode inner = scrollable(element("div", 3, rect(0, 0, 100, 100)), 300, 0);
        RawNode outer = scrollable(element("div", 2, rect(0, 0, 100, 100), inner), 300, 0);
        outer.linkParents();
        SimplifiedNode tree = node(outer, node(inner));

        assertEquals("|SCROLL|<div /> (0.0 pages above, 2.0 pages below)\n\t<div />",
                TreeTextRenderer.render(tree, DEFAULTS));
    }

    @Test
    void invisibleText_isSkipped() {
        RawNode hiddenText = text("Not shown");
        hiddenText.getLayout().setVisible(false);
        SimplifiedNode button = interactive(node(element("button", 1, rect(0, 0, 10, 10)), node(hiddenText)));

        assertEquals("[1]<button />", TreeTextRenderer.render(button, DEFAULTS));
    }

    @Test
    void compoundComponents_followRegularAttributes() {
        SimplifiedNode range = interactive(node(attr(element("input", 4, rect(0, 0, 10, 10)), "type", "range")));
        range.getCompoundChildren().add(CompoundChild.ranged("slider", "Value", 0.0, 100.0));

        assertEquals("[4]<input type=range compound_components=(name=Value,role=slider,min=0.0,max=100.0) />",
                TreeTextRenderer.render(range, DEFAULTS));
    }

    private static SimplifiedNode interactive(SimplifiedNode node) {
        node.setInteractive(true);
        return node;
    }
}
