package com.jctaxes.wards;

import com.jctaxes.TestGeometries;
import com.jctaxes.census.CensusAggregator;
import com.jctaxes.census.CensusBlockTotals;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.census.OverlayAllocator;
import com.jctaxes.census.OverlayFragment;
import com.jctaxes.census.Ward;
import com.jctaxes.geometry.CoordinateTransforms;
import com.jctaxes.geometry.GeometrySettings;
import com.jctaxes.lots.LotRecord;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Wards A and B each have census blocks; ward C has none. One census block claims ward Z, which is not registered.
 */
class WardAggregatorTest {

    private static CensusRegistry registry;

    private static List<OverlayFragment> fragments;

    private static List<CensusBlockTotals> blockTotals;

    private static List<WardTotals> wardTotals;

    @BeforeAll
    static void aggregate () {
        GeometrySettings settings = GeometrySettings.defaults();
        CoordinateTransforms transforms = CoordinateTransforms.forSettings(settings);
        registry = new CensusRegistry(
            Arrays.asList(
                TestGeometries.censusBlock("a1", 100, "A", TestGeometries.rectangle(0, 0, 1000, 1000)),
                TestGeometries.censusBlock("a2", 50, "A", TestGeometries.rectangle(1000, 0, 1000, 1000)),
                TestGeometries.censusBlock("b1", 0, "B", TestGeometries.rectangle(0, 1000, 1000, 1000)),
                TestGeometries.censusBlock("z1", 999, "Z", TestGeometries.rectangle(1000, 1000, 1000, 1000))
            ),
            Arrays.asList(
                new Ward("A", "Alice Example", transforms.toWgs84(TestGeometries.rectangle(0, 0, 2000, 1000))),
                new Ward("B", "Bob Example", transforms.toWgs84(TestGeometries.rectangle(0, 1000, 1000, 1000))),
                new Ward("C", null, transforms.toWgs84(TestGeometries.rectangle(5000, 0, 1000, 1000)))
            )
        );
        List<LotRecord> lots = Arrays.asList(
            TestGeometries.lot("1", "1", TestGeometries.rectangle(100, 100, 100, 100), 1000, 1100),
            TestGeometries.lot("1", "2", TestGeometries.rectangle(950, 100, 100, 100), 2000, 2200),
            TestGeometries.lot("2", "1", TestGeometries.rectangle(100, 1100, 100, 100), 300, 300),
            TestGeometries.lot("2", "2", TestGeometries.rectangle(300, 1100, 100, 100), 0, 0),
            TestGeometries.lot("3", "1", TestGeometries.rectangle(1500, 1500, 100, 100), 7777, 7777)
        );
        fragments = new OverlayAllocator(registry).allocate(lots);
        blockTotals = new CensusAggregator().aggregate(registry, fragments);
        wardTotals = new WardAggregator(new WardGeometryBuilder(settings, transforms))
                .aggregate(registry, blockTotals, fragments);
    }

    @Test
    void everyRegisteredWardAppearsInOrder () {
        assertEquals(3, wardTotals.size());
        assertEquals("A", wardTotals.get(0).ward.id);
        assertEquals("B", wardTotals.get(1).ward.id);
        assertEquals("C", wardTotals.get(2).ward.id);
    }

    @Test
    void wardTotalsAreSumsOfTheirBlocks () {
        for (WardTotals ward : wardTotals) {
            double paid = 0;
            double billed = 0;
            double area = 0;
            int population = 0;
            for (CensusBlockTotals block : blockTotals) {
                if (ward.ward.id.equals(block.block.ward)) {
                    paid += block.paid;
                    billed += block.billed;
                    area += block.areaSqft;
                    population += block.block.population;
                }
            }
            assertEquals(paid, ward.paid, 1e-6);
            assertEquals(billed, ward.billed, 1e-6);
            assertEquals(area, ward.areaSqft, 1e-6);
            assertEquals(population, ward.population);
        }
        assertEquals(3000, wardTotals.get(0).paid, 1e-6);
        assertEquals(150, wardTotals.get(0).population);
        assertEquals(20, wardTotals.get(0).paidPerCapita().getAsDouble(), 1e-9);
    }

    @Test
    void unregisteredWardIsExcluded () {
        double total = 0;
        for (WardTotals ward : wardTotals) {
            total += ward.paid;
        }
        assertEquals(3300, total, 1e-6);
    }

    @Test
    void unpopulatedWardHasNoPerCapita () {
        WardTotals b = wardTotals.get(1);
        assertEquals(300, b.paid, 1e-6);
        assertFalse(b.paidPerCapita().isPresent());
        // Only the paying lot counts toward area.
        assertEquals(10_000, b.areaSqft, 1e-6);
        assertEquals(0.03, b.paidPerSqft(), 1e-9);
    }

    @Test
    void wardWithLotsHasAllGeometries () {
        WardTotals a = wardTotals.get(0);
        assertNotNull(a.mergedBoundary);
        assertNotNull(a.trimmedFootprint);
        assertNotNull(a.blockOutline);
        assertSame(a.mergedBoundary, a.displayGeometry());
        assertTrue(a.mergedBoundary.getEnvelopeInternal().getMaxX() < -73, "Geometries are in WGS84");
        assertEquals(2, a.blockOutline.getNumGeometries(), "The two lots of city block 1 do not touch");
    }

    @Test
    void wardWithoutLotsFallsBackOnRegistryBoundary () {
        WardTotals c = wardTotals.get(2);
        assertEquals(0, c.paid);
        assertEquals(0, c.population);
        assertNull(c.mergedBoundary);
        assertSame(c.ward.wgsGeometry, c.displayGeometry());
    }

}
