package com.pagelens.dom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Accessibility-tree record attached to a DOM node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AxNode {
    private String axNodeId;
    private String role;
    private String name;
    private boolean ignored;
    @Builder.Default
    private List<AxProperty> properties = new ArrayList<>();
    @Builder.Default
    private List<String> childIds = new ArrayList<>();

    public boolean hasChildIds() {
        return childIds != null && !childIds.isEmpty();
    }

    /**
     * First property with the given name, or null.
     */
    public AxProperty findProperty(String propertyName) {
        if (properties == null) {
            return null;
        }
        for (AxProperty property : properties) {
            if (property != null && propertyName.equals(property.getName())) {
                return property;
            }
        }
        return null;
    }
}
