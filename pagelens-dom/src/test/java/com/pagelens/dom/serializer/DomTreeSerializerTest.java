package com.pagelens.dom.serializer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.RawNode;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.pagelens.dom.DomFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DomTreeSerializerTest {

    private static final List<String> DEFAULTS = DomConstants.DEFAULT_INCLUDE_ATTRIBUTES;

    private static final String FILE_INPUT_LINE = "*[30]<input type=file compound_components="
            + "(name=Browse Files,role=button),(name=File Selected,role=textbox,current=None) />";

    @Test
    void serialize_basicPage() {
        SerializationResult result = new DomTreeSerializer(page()).serialize();

        assertEquals("[10]<button />\n\tSubmit\n[20]<a />\n\tDocs\n" + FILE_INPUT_LINE,
                result.state().llmRepresentation(DEFAULTS));
        assertEquals(List.of(10, 20, 30), new ArrayList<>(result.state().getSelectorMap().keySet()));
    }

    @Test
    void serialize_hiddenFileInputIsAddressable() {
        SerializationResult result = new DomTreeSerializer(page()).serialize();

        RawNode fileInput = result.state().getSelectorMap().get(30);
        assertNotNull(fileInput);
        assertTrue(fileInput.isFileInput());
        assertFalse(fileInput.isVisible());
    }

    @Test
    void serialize_everyRenderedIndexIsInSelectorMap() {
        SerializationResult result = new DomTreeSerializer(page()).serialize();
        String text = result.state().llmRepresentation(DEFAULTS);

        for (Integer id : result.state().getSelectorMap().keySet()) {
            assertTrue(text.contains("[" + id + "]"), "missing index " + id);
        }
        assertEquals(3, text.split("\\[\\d+]", -1).length - 1);
    }

    @Test
    void serialize_marksElementsMissingFromPreviousState() {
        SerializedDomState first = new DomTreeSerializer(page()).serialize().state();

        RawNode secondPage = page();
        RawNode body = secondPage.getChildren().get(0).getChildren().get(0);
        body.getChildren().add(element("button", 40, rect(10, 200, 100, 30), text("Next")));
        secondPage.linkParents();

        String text = new DomTreeSerializer(secondPage, first, SerializerOptions.defaults())
                .serialize().state().llmRepresentation(DEFAULTS);

        assertTrue(text.contains("*[40]<button />"));
        assertTrue(text.startsWith("[10]<button />"));
        assertTrue(text.contains("\n[20]<a />"));
    }

    @Test
    void serialize_unchangedPage_onlyCompoundControlsAreNew() {
        SerializedDomState first = new DomTreeSerializer(page()).serialize().state();

        String text = new DomTreeSerializer(page(), first, SerializerOptions.defaults())
                .serialize().state().llmRepresentation(DEFAULTS);

        assertEquals("[10]<button />\n\tSubmit\n[20]<a />\n\tDocs\n" + FILE_INPUT_LINE, text);
    }

    @Test
    void selectorMap_matchesInteractiveNodesExactly() {
        SerializedDomState state = new DomTreeSerializer(page()).serialize().state();

        List<Integer> interactiveIds = new ArrayList<>();
        collectInteractive(state.getRoot(), interactiveIds);

        assertEquals(interactiveIds, new ArrayList<>(state.getSelectorMap().keySet()));
        for (Integer id : interactiveIds) {
            assertEquals(id.intValue(), state.getSelectorMap().get(id).getBackendNodeId());
        }
    }

    @Test
    void serialize_sameTreeTwice_isDeterministic() {
        RawNode root = page();

        String first = new DomTreeSerializer(root).serialize().state().llmRepresentation(DEFAULTS);
        String second = new DomTreeSerializer(root).serialize().state().llmRepresentation(DEFAULTS);

        assertEquals(first, second);
    }

    @Test
    void serialize_bboxFilteringDisabled_keepsNestedSpanUnexcluded() {
        SerializerOptions options = SerializerOptions.builder().bboxFilteringEnabled(false).build();
        RawNode root = page();
        RawNode link = root.getChildren().get(0).getChildren().get(0).getChildren().get(1);
        attr(link.getChildren().get(0), "onmouseup", "track()");

        SerializationResult result = new DomTreeSerializer(root, null, options).serialize();

        assertTrue(result.state().getSelectorMap().containsKey(21));
        assertFalse(result.timings().containsKey(DomTreeSerializer.STAGE_BBOX));
    }

    @Test
    void serialize_recordsStageTimings() {
        SerializationResult result = new DomTreeSerializer(page()).serialize();

        for (String key : List.of("create_simplified_tree", "calculate_paint_order", "optimize_tree",
                "bbox_filtering", "assign_interactive_indices", "clickable_detection_time",
                "serialize_accessible_elements_total")) {
            assertTrue(result.timings().containsKey(key), key);
            assertTrue(result.timings().get(key) >= 0, key);
        }
    }

    @Test
    void scrollContainer_withInteractiveDescendants_isNotIndexed() {
        RawNode panel = scrollable(element("div", 50, rect(0, 0, 100, 100),
                element("button", 51, rect(0, 0, 50, 20), text("Go"))), 300, 0);
        RawNode root = wrap(panel);

        String text = new DomTreeSerializer(root).serialize().state().llmRepresentation(DEFAULTS);

        assertEquals("|SCROLL|<div /> (0.0 pages above, 2.0 pages below)\n\t[51]<button />\n\t\tGo", text);
    }

    @Test
    void scrollContainer_withoutInteractiveDescendants_isIndexed() {
        RawNode panel = scrollable(element("div", 50, rect(0, 0, 100, 100), text("Long article body")), 300, 0);
        RawNode root = wrap(panel);

        SerializationResult result = new DomTreeSerializer(root).serialize();

        assertEquals("|SCROLL[50]<div /> (0.0 pages above, 2.0 pages below)\n\tLong article body",
                result.state().llmRepresentation(DEFAULTS));
        assertTrue(result.state().getSelectorMap().containsKey(50));
    }

    @Test
    void occludedButton_isNotIndexed_unlessPaintOrderFilteringDisabled() {
        RawNode button = element("button", 60, rect(10, 10, 100, 30));
        button.getLayout().setPaintOrder(1);
        RawNode overlay = element("div", 61, rect(0, 0, 500, 500));
        overlay.getLayout().setPaintOrder(5);
        style(overlay, "background-color", "rgb(255, 255, 255)");

        SerializationResult filtered = new DomTreeSerializer(wrap(button, overlay)).serialize();
        SerializationResult unfiltered = new DomTreeSerializer(wrap(button, overlay), null,
                SerializerOptions.builder().paintOrderFilteringEnabled(false).build()).serialize();

        assertFalse(filtered.state().getSelectorMap().containsKey(60));
        assertTrue(unfiltered.state().getSelectorMap().containsKey(60));
    }

    @Test
    void customOracle_decidesInteractivity() {
        RawNode card = element("div", 70, rect(0, 0, 100, 100), text("Card title"));
        DomTreeSerializer serializer = new DomTreeSerializer(wrap(card), null, SerializerOptions.defaults(),
                node -> "div".equals(node.getTagName()), null);

        String text = serializer.serialize().state().llmRepresentation(DEFAULTS);

        assertEquals("[70]<div />\n\tCard title", text);
    }

    @Test
    void sessionExclusion_removesSubtree() {
        RawNode hiddenByAgent = attr(element("button", 80, rect(0, 0, 10, 10)), "data-browser-use-exclude-s1", "true");
        SerializerOptions options = SerializerOptions.builder().sessionId("s1").build();

        SerializationResult result = new DomTreeSerializer(wrap(hiddenByAgent), null, options).serialize();

        assertTrue(result.state().getSelectorMap().isEmpty());
    }

    @Test
    void emptyDocument_rendersEmptyString() {
        SerializationResult result = new DomTreeSerializer(document()).serialize();

        assertNull(result.state().getRoot());
        assertEquals("", result.state().llmRepresentation(DEFAULTS));
        assertTrue(result.state().getSelectorMap().isEmpty());
    }

    @Test
    void selectorMap_isReadOnly() {
        SerializedDomState state = new DomTreeSerializer(page()).serialize().state();

        assertThrows(UnsupportedOperationException.class, () -> state.getSelectorMap().clear());
    }

    @Test
    void serialize_invalidThresholdWarnsOnceAcrossRuns() {
        Logger optionsLogger = (Logger) LoggerFactory.getLogger(SerializerOptions.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        optionsLogger.addAppender(appender);
        try {
            SerializerOptions options = SerializerOptions.builder().containmentThreshold(2.0).build();
            DomTreeSerializer serializer = new DomTreeSerializer(page(), null, options);

            serializer.serialize();
            serializer.serialize();

            assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD, serializer.containmentThreshold());
            long warnings = appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
            assertEquals(1, warnings);
        } finally {
            optionsLogger.detachAppender(appender);
        }
    }

    private static void collectInteractive(SimplifiedNode node, List<Integer> out) {
        if (node.isInteractive()) {
            out.add(node.getBackendNodeId());
        }
        for (SimplifiedNode child : node.getChildren()) {
            collectInteractive(child, out);
        }
    }

    /**
     * document > html > body > [button#10 "Submit", a#20 > span#21 "Docs", hidden file input#30]
     */
    private static RawNode page() {
        RawNode button = element("button", 10, rect(10, 10, 100, 30), text("Submit"));
        RawNode link = element("a", 20, rect(10, 50, 200, 30),
                element("span", 21, rect(20, 55, 50, 20), text("Docs")));
        RawNode fileInput = attr(hidden("input", 30), "type", "file");
        return wrap(button, link, fileInput);
    }

    private static RawNode wrap(RawNode... bodyChildren) {
        RawNode body = element("body", 2, rect(0, 0, 1000, 800), bodyChildren);
        RawNode html = element("html", 1, rect(0, 0, 1000, 800), body);
        return document(html).linkParents();
    }
}
