package com.jctaxes.aggregation;

import com.jctaxes.util.Rates;
import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One output row at any aggregation level: identifying attributes, totals and a WGS84 geometry to draw. The
 * attribute and auxiliary geometry maps keep insertion order, which becomes the property order in the output file.
 */
public class AggregateResult {

    public final String key;

    public final Geometry geometry;

    public final double paid;

    public final double billed;

    public final double areaSqft;

    /** Null at levels that carry no population. */
    public final Integer population;

    /** Identifying and descriptive attributes, e.g. block and lot, or geoid and ward. Values are never null. */
    public final Map<String, Object> attributes = new LinkedHashMap<>();

    /** Alternate WGS84 shapes written as extra properties after the totals. */
    public final Map<String, Geometry> auxiliaryGeometries = new LinkedHashMap<>();

    public AggregateResult (String key, Geometry geometry, double paid, double billed, double areaSqft, Integer population) {
        this.key = key;
        this.geometry = geometry;
        this.paid = paid;
        this.billed = billed;
        this.areaSqft = areaSqft;
        this.population = population;
    }

    /** Add an attribute, or do nothing if the value is null. Returns this for chaining. */
    public AggregateResult withAttribute (String name, Object value) {
        if (value != null) {
            attributes.put(name, value);
        }
        return this;
    }

    public AggregateResult withAuxiliaryGeometry (String name, Geometry geometry) {
        if (geometry != null) {
            auxiliaryGeometries.put(name, geometry);
        }
        return this;
    }

    public double paidPerSqft () {
        return Rates.perSqft(paid, areaSqft);
    }

    /** Empty when the level has no population or the population is zero. */
    public OptionalDouble paidPerCapita () {
        if (population == null) {
            return OptionalDouble.empty();
        }
        return Rates.perCapita(paid, population);
    }

    @Override
    public String toString () {
        return String.format("%s (paid %.2f, billed %.2f)", key, paid, billed);
    }

}
