package com.jctaxes.datasource;

import com.jctaxes.TestData;
import com.jctaxes.census.CensusBlock;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.geometry.CoordinateTransforms;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.geometry.GeometrySettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CensusRegistryReaderTest {

    private final GeometryNormalizer normalizer = new GeometryNormalizer(
        CoordinateTransforms.forSettings(GeometrySettings.defaults()), GeometrySettings.defaults()
    );

    @Test
    void readBlocksAndWards () {
        CensusRegistry registry = new CensusRegistryReader(normalizer)
                .read(TestData.fixture("census-blocks.geojson"), TestData.fixture("wards.geojson"));
        assertEquals(3, registry.blocks.size());
        CensusBlock first = registry.blocks.get(0);
        assertEquals("340170001001000", first.geoid);
        assertEquals(100, first.population);
        assertEquals("A", first.ward);
        assertEquals(1_000_000, first.planarGeometry.getArea(), 1e-6);
        assertTrue(first.wgsGeometry.getEnvelopeInternal().getMaxX() < -73);
        // A population that is not a number counts as zero.
        assertEquals(0, registry.blocks.get(1).population);
        assertEquals(50, registry.blocks.get(2).population);

        assertEquals(2, registry.wards.size());
        assertEquals("Alice Example", registry.getWard("A").councilPerson);
        assertEquals("Bob Example", registry.getWard("B").councilPerson, "Truncated field name is recognized");
    }

    @Test
    void parsePopulation () {
        assertEquals(12, CensusRegistryReader.parsePopulation("12"));
        assertEquals(12, CensusRegistryReader.parsePopulation("12.0"));
        assertEquals(0, CensusRegistryReader.parsePopulation("n/a"));
        assertEquals(0, CensusRegistryReader.parsePopulation(null));
    }

}
