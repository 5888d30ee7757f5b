package com.jctaxes.geometry;

import com.jctaxes.TestGeometries;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Normalization of planar and geographic inputs, using the real NJ state plane transform.
 */
class GeometryNormalizerTest {

    private static CoordinateTransforms transforms;

    private static GeometryNormalizer normalizer;

    @BeforeAll
    static void createTransforms () {
        transforms = CoordinateTransforms.forSettings(GeometrySettings.defaults());
        normalizer = new GeometryNormalizer(transforms, GeometrySettings.defaults());
    }

    @Test
    void planarInputIsKeptAndProjectedToJerseyCity () {
        Polygon planar = TestGeometries.rectangle(0, 0, 100, 200);
        NormalizedGeometry normalized = normalizer.normalize(RawGeometry.parsed(planar));
        assertEquals(ReferenceSystem.PLANAR, normalized.sourceClassification.referenceSystem);
        assertSame(planar, normalized.planarGeometry);
        assertEquals(20_000, normalized.areaSqft(), 1e-6);
        Envelope wgsEnvelope = normalized.wgsGeometry.getEnvelopeInternal();
        assertTrue(wgsEnvelope.getMinX() > -74.2 && wgsEnvelope.getMaxX() < -73.9, "Longitude of Jersey City");
        assertTrue(wgsEnvelope.getMinY() > 40.6 && wgsEnvelope.getMaxY() < 40.85, "Latitude of Jersey City");
    }

    @Test
    void geographicInputRoundTripsThroughPlanar () {
        Polygon planar = TestGeometries.rectangle(0, 0, 300, 300);
        Geometry wgs = transforms.toWgs84(planar);
        NormalizedGeometry normalized = normalizer.normalize(RawGeometry.parsed(wgs));
        assertEquals(ReferenceSystem.GEOGRAPHIC, normalized.sourceClassification.referenceSystem);
        assertSame(wgs, normalized.wgsGeometry);
        // Projection distortion over a few hundred feet is far below a square foot.
        assertEquals(90_000, normalized.areaSqft(), 1);
        Coordinate centre = normalized.planarGeometry.getEnvelopeInternal().centre();
        assertEquals(TestGeometries.ORIGIN_X + 150, centre.x, 0.01);
        assertEquals(TestGeometries.ORIGIN_Y + 150, centre.y, 0.01);
    }

    @Test
    void transformsDoNotModifyInput () {
        Polygon planar = TestGeometries.rectangle(0, 0, 10, 10);
        Polygon copy = (Polygon) planar.copy();
        transforms.toWgs84(planar);
        assertTrue(copy.equalsExact(planar));
    }

    /** A bowtie is invalid; after repair it can take part in unions and overlays. */
    @Test
    void invalidPolygonIsRepaired () {
        double x = TestGeometries.ORIGIN_X;
        double y = TestGeometries.ORIGIN_Y;
        Polygon bowtie = TestGeometries.geometryFactory.createPolygon(new Coordinate[] {
            new Coordinate(x, y),
            new Coordinate(x + 100, y + 100),
            new Coordinate(x + 100, y),
            new Coordinate(x, y + 100),
            new Coordinate(x, y)
        });
        assertFalse(bowtie.isValid());
        NormalizedGeometry normalized = normalizer.normalize(RawGeometry.parsed(bowtie));
        assertTrue(normalized.planarGeometry.isValid());
        assertEquals(5_000, normalized.areaSqft(), 1e-6);
    }

    @Test
    void invalidGeographicPolygonIsRepaired () {
        Polygon bowtie = TestGeometries.geometryFactory.createPolygon(new Coordinate[] {
            new Coordinate(-74.050, 40.720),
            new Coordinate(-74.049, 40.721),
            new Coordinate(-74.049, 40.720),
            new Coordinate(-74.050, 40.721),
            new Coordinate(-74.050, 40.720)
        });
        NormalizedGeometry normalized = normalizer.normalize(RawGeometry.parsed(bowtie));
        assertEquals(ReferenceSystem.GEOGRAPHIC, normalized.sourceClassification.referenceSystem);
        assertTrue(normalized.wgsGeometry.isValid());
        assertTrue(normalized.planarGeometry.isValid());
    }

    @Test
    void ambiguousClassificationIsStillProcessed () {
        // Planar-looking X with a Y far too small for New Jersey.
        Polygon odd = TestGeometries.geometryFactory.createPolygon(new Coordinate[] {
            new Coordinate(610_000, 10),
            new Coordinate(610_100, 10),
            new Coordinate(610_100, 110),
            new Coordinate(610_000, 10)
        });
        NormalizedGeometry normalized = normalizer.normalize(RawGeometry.parsed(odd));
        assertTrue(normalized.sourceClassification.ambiguous);
        assertEquals(ReferenceSystem.PLANAR, normalized.sourceClassification.referenceSystem);
    }

    @Test
    void corruptGeometryThrows () {
        assertThrows(GeometryParseException.class,
                () -> normalizer.normalize(RawGeometry.wellKnownBinary(new byte[] {0, 0, 0, 0, 3})));
    }

    @Test
    void unknownCrsIsRejected () {
        assertThrows(IllegalArgumentException.class, () -> CoordinateTransforms.forPlanarCrs("EPSG:999999"));
    }

}
