package com.pagelens.dom.serializer;

import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.RawNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pagelens.dom.DomFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AttributeStringBuilderTest {

    private static final List<String> DEFAULTS = DomConstants.DEFAULT_INCLUDE_ATTRIBUTES;

    @Test
    void onlyAllowListedNonEmptyAttributesAreRendered() {
        RawNode div = attr(attr(attr(hidden("div", 1), "class", "card"), "id", "main"), "title", "  ");

        assertEquals("id=main", AttributeStringBuilder.build(div, DEFAULTS, ""));
    }

    @Test
    void dateInput_getsIsoFormatAndPlaceholder() {
        RawNode date = attr(hidden("input", 1), "type", "date");

        assertEquals("type=date format=YYYY-MM-DD placeholder=YYYY-MM-DD",
                AttributeStringBuilder.build(date, DEFAULTS, ""));
    }

    @Test
    void dateInput_keepsExistingPlaceholder() {
        RawNode date = attr(attr(hidden("input", 1), "type", "date"), "placeholder", "Pick a day");

        assertEquals("type=date placeholder=Pick a day format=YYYY-MM-DD",
                AttributeStringBuilder.build(date, DEFAULTS, ""));
    }

    @Test
    void dateInput_withoutPlaceholderAllowed_onlyGetsFormat() {
        RawNode date = attr(hidden("input", 1), "type", "week");

        assertEquals("type=week format=YYYY-W##",
                AttributeStringBuilder.build(date, List.of("type", "format"), ""));
    }

    @Test
    void telInput_getsPlaceholderUnlessPatterned() {
        RawNode tel = attr(hidden("input", 1), "type", "tel");
        RawNode patterned = attr(attr(hidden("input", 2), "type", "tel"), "pattern", "[0-9]{10}");

        assertEquals("type=tel placeholder=123-456-7890", AttributeStringBuilder.build(tel, DEFAULTS, ""));
        assertFalse(AttributeStringBuilder.build(patterned, DEFAULTS, "").contains("placeholder"));
    }

    @Test
    void datepickerClass_getsDefaultFormat() {
        RawNode input = attr(attr(hidden("input", 1), "type", "text"), "class", "form-control DatePicker");

        assertEquals("type=text placeholder=mm/dd/yyyy format=mm/dd/yyyy",
                AttributeStringBuilder.build(input, DEFAULTS, ""));
    }

    @Test
    void datepicker_usesDeclaredDateFormat() {
        RawNode input = attr(attr(hidden("input", 1), "data-datepicker", "on"), "data-date-format", "dd.mm.yyyy");

        String rendered = AttributeStringBuilder.build(input, DEFAULTS, "");

        assertTrue(rendered.contains("placeholder=dd.mm.yyyy"));
        assertTrue(rendered.contains("format=dd.mm.yyyy"));
    }

    @Test
    void angularDatepicker_setsExpectedFormat() {
        RawNode input = attr(attr(hidden("input", 1), "type", "text"), "uib-datepicker-popup", "dd/MM/yyyy");

        String rendered = AttributeStringBuilder.build(input, DEFAULTS, "");

        assertTrue(rendered.contains("expected_format=dd/MM/yyyy"));
        assertTrue(rendered.contains("format=dd/MM/yyyy"));
        assertFalse(rendered.contains("placeholder"));
    }

    @Test
    void liveValue_overridesMarkupValue() {
        RawNode input = withAx(attr(hidden("input", 1), "value", "old"), "textbox",
                prop("valuetext", "typed by user"));

        assertEquals("value=typed by user", AttributeStringBuilder.build(input, DEFAULTS, ""));
    }

    @Test
    void duplicateLongValues_keepFirstInAllowListOrder() {
        RawNode input = attr(attr(hidden("input", 1), "name", "searchbox"), "id", "searchbox");

        assertEquals("id=searchbox", AttributeStringBuilder.build(input, DEFAULTS, ""));
    }

    @Test
    void duplicateShortValues_areKept() {
        RawNode input = attr(attr(hidden("input", 1), "id", "q"), "name", "q");

        assertEquals("id=q name=q", AttributeStringBuilder.build(input, DEFAULTS, ""));
    }

    @Test
    void redundantAttributes_areDropped() {
        RawNode button = withAx(attr(hidden("button", 1), "role", "button"), "button",
                prop("invalid", "false"), prop("required", false), prop("expanded", true));
        attr(button, "aria-expanded", "true");

        assertEquals("expanded=true", AttributeStringBuilder.build(button, DEFAULTS, ""));
    }

    @Test
    void attributesRepeatingText_areDropped() {
        RawNode button = attr(attr(hidden("button", 1), "aria-label", "Submit"), "id", "submit-btn");

        assertEquals("id=submit-btn", AttributeStringBuilder.build(button, DEFAULTS, " submit "));
    }

    @Test
    void longValues_areCapped() {
        RawNode div = attr(hidden("div", 1), "title", "x".repeat(150));

        assertEquals("title=" + "x".repeat(100) + "...", AttributeStringBuilder.build(div, DEFAULTS, ""));
    }

    @Test
    void unreadableAccessibilityProperty_isSkipped() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("detached");
            }
        };
        RawNode div = withAx(hidden("div", 1), "generic", prop("busy", broken), prop("level", 2));

        assertEquals("level=2", AttributeStringBuilder.build(div, DEFAULTS, ""));
    }

    @Test
    void compoundComponents_format() {
        List<CompoundChild> children = List.of(
                CompoundChild.of("button", "Dropdown Toggle"),
                CompoundChild.builder()
                        .role("listbox")
                        .name("Options")
                        .optionsCount(6)
                        .firstOptions(List.of("1", "2", "3", "4", "... 2 more options..."))
                        .formatHint("numeric")
                        .build());

        assertEquals("compound_components=(name=Dropdown Toggle,role=button),"
                        + "(name=Options,role=listbox,count=6,options=1|2|3|4,format=numeric)",
                AttributeStringBuilder.buildCompoundComponents(children));
    }

    @Test
    void compoundComponents_rangedValues() {
        List<CompoundChild> children = List.of(CompoundChild.ranged("slider", "Value", 10.0, 50.0));

        assertEquals("compound_components=(name=Value,role=slider,min=10.0,max=50.0)",
                AttributeStringBuilder.buildCompoundComponents(children));
        assertEquals("", AttributeStringBuilder.buildCompoundComponents(List.of()));
    }
}
