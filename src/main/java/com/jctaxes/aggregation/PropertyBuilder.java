package com.jctaxes.aggregation;

/**
 * Adds level-specific descriptive attributes to results after they have been computed. Implementations must not
 * change totals or geometries.
 */
public interface PropertyBuilder {

    void addProperties (AggregateResult result);

}
