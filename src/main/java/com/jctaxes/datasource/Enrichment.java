package com.jctaxes.datasource;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Descriptive attributes (address, owner, street names) for units, lots and blocks, keyed on the same join keys as
 * the payments. These are produced by an upstream text extraction step and are purely decorative: a missing entry
 * just means the attribute is left out of the output.
 */
public class Enrichment {

    public static final String ADDR = "addr";
    public static final String OWNER = "owner";
    public static final String STREETS = "streets";

    public static final Enrichment EMPTY = new Enrichment(ImmutableMap.of());

    private final Map<String, Map<String, String>> attributesByKey;

    public Enrichment (Map<String, Map<String, String>> attributesByKey) {
        this.attributesByKey = ImmutableMap.copyOf(attributesByKey);
    }

    /** @return the attribute value, or null if there is none for this key. */
    public String get (String key, String attribute) {
        Map<String, String> attributes = attributesByKey.get(key);
        return attributes == null ? null : attributes.get(attribute);
    }

    public int size () {
        return attributesByKey.size();
    }

}
