package com.jctaxes.output;

import com.jctaxes.TestGeometries;
import com.jctaxes.aggregation.AggregateResult;
import com.jctaxes.aggregation.AggregationLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Geometry;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureWriterTest {

    private static List<AggregateResult> results () {
        AggregateResult populated = new AggregateResult(
            "340170001001000", TestGeometries.rectangle(0, 0, 10, 10), 1234.5678, 2000.004, 1000.06, 100
        ).withAttribute("geoid", "340170001001000").withAttribute("ward", "A");
        AggregateResult empty = new AggregateResult(
            "340170001001001", TestGeometries.rectangle(10, 0, 10, 10), 0, 0, 0, 0
        ).withAttribute("geoid", "340170001001001").withAttribute("ward", null);
        return Arrays.asList(populated, empty);
    }

    @Test
    void propertiesAreRoundedAndOrdered () {
        GeoJsonFeature feature = FeatureWriter.toFeature(results().get(0), 2024);
        Map<String, Object> properties = feature.getProperties();
        assertEquals(
            Arrays.asList("geoid", "ward", "year", "paid", "billed", "area_sqft", "paid_per_sqft",
                    "population", "paid_per_capita"),
            new ArrayList<>(properties.keySet())
        );
        assertEquals(2024, properties.get("year"));
        assertEquals(1234.57, properties.get("paid"));
        assertEquals(2000.0, properties.get("billed"));
        assertEquals(1000.1, properties.get("area_sqft"));
        assertEquals(1.23, properties.get("paid_per_sqft"));
        assertEquals(12.35, properties.get("paid_per_capita"));
    }

    @Test
    void absentValuesAreOmitted () {
        GeoJsonFeature feature = FeatureWriter.toFeature(results().get(1), 2024);
        Map<String, Object> properties = feature.getProperties();
        assertFalse(properties.containsKey("ward"));
        assertFalse(properties.containsKey("paid_per_capita"));
        assertEquals(0.0, properties.get("paid_per_sqft"));
        assertEquals(0, properties.get("population"));
    }

    @Test
    void lotLevelHasNoPopulation () {
        AggregateResult lot = new AggregateResult("100-5", TestGeometries.rectangle(0, 0, 10, 10), 10, 10, 100, null)
                .withAttribute("block", "100").withAttribute("lot", "5");
        Map<String, Object> properties = FeatureWriter.toFeature(lot, 2024).getProperties();
        assertFalse(properties.containsKey("population"));
        assertFalse(properties.containsKey("paid_per_capita"));
        assertEquals(0.1, properties.get("paid_per_sqft"));
    }

    @Test
    void writeThenRead (@TempDir File tempDir) {
        AggregateResult ward = new AggregateResult("A", TestGeometries.rectangle(0, 0, 10, 10), 5, 6, 7, 8)
                .withAttribute("ward", "A")
                .withAuxiliaryGeometry("boundary", TestGeometries.rectangle(0, 0, 20, 20));
        List<AggregateResult> results = new ArrayList<>(results());
        results.add(ward);
        File file = FeatureWriter.write(results, 2024, AggregationLevel.CENSUS_BLOCK, new File(tempDir, "out"));
        assertEquals("taxes-2024-census-blocks.geojson", file.getName());
        assertTrue(file.exists());

        GeoJsonFeatureCollection collection = FeatureWriter.read(file);
        assertEquals("FeatureCollection", collection.type);
        assertEquals(3, collection.features.size());
        GeoJsonFeature first = collection.features.get(0);
        assertEquals("340170001001000", first.getProperties().get("geoid"));
        assertEquals(1234.57, ((Number) first.getProperties().get("paid")).doubleValue());
        assertEquals(100, ((Number) first.getProperties().get("population")).intValue());
        Geometry geometry = first.getGeometry();
        assertEquals(100, geometry.getArea(), 1e-3);
        Object boundary = collection.features.get(2).getProperties().get("boundary");
        assertTrue(boundary instanceof Map);
        assertEquals("Polygon", ((Map<?, ?>) boundary).get("type"));
    }

}
