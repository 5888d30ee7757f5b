package com.jctaxes.aggregation;

import com.google.common.collect.ImmutableList;
import com.jctaxes.datasource.Enrichment;

import java.util.List;

/** Looks up descriptive attributes such as address and owner by the result's join key. */
public class EnrichmentPropertyBuilder implements PropertyBuilder {

    private final Enrichment enrichment;

    private final List<String> attributeNames;

    public EnrichmentPropertyBuilder (Enrichment enrichment, String... attributeNames) {
        this.enrichment = enrichment;
        this.attributeNames = ImmutableList.copyOf(attributeNames);
    }

    @Override
    public void addProperties (AggregateResult result) {
        for (String name : attributeNames) {
            String value = enrichment.get(result.key, name);
            if (value == null && result.key.endsWith("-")) {
                // A unit without a qualifier is the whole lot, described under its block-lot key.
                value = enrichment.get(result.key.substring(0, result.key.length() - 1), name);
            }
            result.withAttribute(name, value);
        }
    }

}
