package com.jctaxes.datasource;

import com.fasterxml.jackson.databind.JsonNode;

/** Lenient access to the properties object of a GeoJSON feature. */
abstract class GeoJsonProperties {

    /**
     * @return the property as text (numbers included) trimmed, or null if it is absent, null or blank. The name is
     * tried as given and then in upper case.
     */
    static String text (JsonNode properties, String name) {
        JsonNode node = properties.get(name);
        if (node == null || node.isNull()) {
            node = properties.get(name.toUpperCase());
        }
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

}
