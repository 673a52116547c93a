package com.pagelens.dom.serializer;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Synthetic sub-widget of a native compound control (e.g. the thumb of a
 * range slider). Not a tree node; rendered as part of the owner's
 * {@code compound_components} attribute.
 */
@Value
@Builder
public class CompoundChild {
    String role;
    String name;
    Number valueMin;
    Number valueMax;
    String valueNow;
    Integer optionsCount;
    List<String> firstOptions;
    String formatHint;

    public static CompoundChild of(String role, String name) {
        return CompoundChild.builder().role(role).name(name).build();
    }

    public static CompoundChild ranged(String role, String name, Number min, Number max) {
        return CompoundChild.builder().role(role).name(name).valueMin(min).valueMax(max).build();
    }
}
