package com.jctaxes.geometry;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw geometry in any of the supported encodings into one canonical geometry, in both WGS84 and planar feet.
 *
 * Parcel and census geometries never come with reliable CRS metadata, so the source system is guessed from the
 * coordinate magnitudes (see {@link CrsClassification}) and the appropriate one of the two fixed transforms is applied
 * to obtain the other representation. Invalid polygons (self-intersections, unclosed slivers) are repaired so that
 * later union and overlay operations do not fail on them.
 *
 * This class has no mutable state of its own; everything it needs is supplied at construction.
 */
public class GeometryNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryNormalizer.class);

    private final GeometryFactory geometryFactory;

    private final CoordinateTransforms transforms;

    private final double projectedMinX;

    public GeometryNormalizer (GeometryFactory geometryFactory, CoordinateTransforms transforms, double projectedMinX) {
        this.geometryFactory = geometryFactory;
        this.transforms = transforms;
        this.projectedMinX = projectedMinX;
    }

    public GeometryNormalizer (CoordinateTransforms transforms, GeometrySettings settings) {
        this(new GeometryFactory(), transforms, settings.projectedMinX);
    }

    /**
     * @throws GeometryParseException if the raw geometry cannot be decoded or reprojected.
     */
    public NormalizedGeometry normalize (RawGeometry rawGeometry) {
        Geometry source = rawGeometry.decode(geometryFactory);
        CrsClassification classification = CrsClassification.classify(source.getEnvelopeInternal(), projectedMinX);
        if (classification.ambiguous) {
            LOG.debug("Ambiguous reference system for {} geometry: {}", rawGeometry.encoding(), classification.reason);
        }
        Geometry wgs;
        Geometry planar;
        try {
            if (classification.referenceSystem == ReferenceSystem.PLANAR) {
                planar = repair(source);
                wgs = transforms.toWgs84(planar);
            } else {
                // Unions of display geometries fail on invalid input just as planar ones do.
                wgs = repair(source);
                planar = repair(transforms.toPlanar(wgs));
            }
        } catch (RuntimeException e) {
            throw new GeometryParseException("Could not reproject geometry from " + classification, e);
        }
        return new NormalizedGeometry(wgs, planar, classification);
    }

    /**
     * Repair invalid polygonal geometry. Both representations are repaired, since each is dissolved separately.
     * Non-polygonal and already valid geometries are returned unchanged.
     */
    private static Geometry repair (Geometry geometry) {
        if (geometry instanceof Polygonal && !geometry.isValid()) {
            return GeometryFixer.fix(geometry);
        }
        return geometry;
    }

}
