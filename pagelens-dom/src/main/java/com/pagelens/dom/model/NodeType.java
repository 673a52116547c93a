package com.pagelens.dom.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * DOM node kinds, with the numeric codes defined by the DOM standard and used by CDP.
 */
public enum NodeType {
    ELEMENT_NODE(1),
    ATTRIBUTE_NODE(2),
    TEXT_NODE(3),
    CDATA_SECTION_NODE(4),
    PROCESSING_INSTRUCTION_NODE(7),
    COMMENT_NODE(8),
    DOCUMENT_NODE(9),
    DOCUMENT_TYPE_NODE(10),
    DOCUMENT_FRAGMENT_NODE(11);

    private final int code;

    NodeType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static NodeType fromCode(int code) {
        for (NodeType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown DOM node type code: " + code);
    }

    /**
     * Accepts either the numeric code or the constant name.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeType fromJson(Object raw) {
        if (raw instanceof Number number) {
            return fromCode(number.intValue());
        }
        String text = String.valueOf(raw).trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(text));
        }
        return valueOf(text.toUpperCase());
    }
}
