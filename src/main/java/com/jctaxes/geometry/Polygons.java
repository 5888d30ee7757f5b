package com.jctaxes.geometry;

import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Static helpers for the polygon operations shared by the aggregation stages: dissolving, intersecting, simplifying
 * and hole removal. All of these expect planar coordinates, where distances and areas are in feet.
 */
public abstract class Polygons {

    private static final Logger LOG = LoggerFactory.getLogger(Polygons.class);

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Union a collection of geometries into one (possibly multi-part) geometry.
     * A collection of one is returned as is, without performing a needless union.
     * The cascaded union occasionally fails on nearly coincident edges; in that case we fall back on the snapping
     * overlay, which is slower but robust.
     */
    public static Geometry dissolve (Collection<Geometry> geometries) {
        if (geometries.isEmpty()) {
            return geometryFactory.createMultiPolygon();
        }
        if (geometries.size() == 1) {
            return geometries.iterator().next();
        }
        try {
            return new UnaryUnionOp(geometries).union();
        } catch (TopologyException e) {
            LOG.debug("Cascaded union of {} geometries failed, retrying with robust overlay: {}",
                    geometries.size(), e.getMessage());
            return OverlayNGRobust.union(geometries);
        }
    }

    /** The intersection of two polygonal geometries, retaining only its polygonal part. */
    public static Geometry intersection (Geometry a, Geometry b) {
        Geometry intersection;
        try {
            intersection = a.intersection(b);
        } catch (TopologyException e) {
            intersection = OverlayNGRobust.overlay(a, b, OverlayNG.INTERSECTION);
        }
        return polygonalPart(intersection);
    }

    /**
     * Overlay results may contain lines and points where shapes merely touch. Those have no area and are dropped.
     * The result is a Polygon or MultiPolygon, possibly empty.
     */
    public static Geometry polygonalPart (Geometry geometry) {
        if (geometry instanceof Polygon || geometry instanceof MultiPolygon) {
            return geometry;
        }
        List<Polygon> polygons = new ArrayList<>();
        PolygonExtracter.getPolygons(geometry, polygons);
        return toMultiPolygon(polygons);
    }

    /** Collect the polygonal components of the given geometries into one MultiPolygon, without any union. */
    public static MultiPolygon toMultiPolygon (Collection<? extends Geometry> geometries) {
        List<Polygon> polygons = new ArrayList<>();
        for (Geometry geometry : geometries) {
            PolygonExtracter.getPolygons(geometry, polygons);
        }
        return geometryFactory.createMultiPolygon(polygons.toArray(new Polygon[0]));
    }

    /**
     * Simplify without letting shapes collapse or rings cross. A zero tolerance returns the input unchanged.
     */
    public static Geometry simplify (Geometry geometry, double tolerance) {
        if (tolerance <= 0 || geometry.isEmpty()) {
            return geometry;
        }
        return TopologyPreservingSimplifier.simplify(geometry, tolerance);
    }

    /**
     * Remove interior rings whose area is strictly below the given threshold. Holes of exactly the threshold area or
     * larger are kept. Non-polygonal components are discarded.
     */
    public static Geometry removeSmallHoles (Geometry geometry, double minHoleArea) {
        List<Polygon> polygons = new ArrayList<>();
        PolygonExtracter.getPolygons(geometry, polygons);
        List<Polygon> result = new ArrayList<>(polygons.size());
        for (Polygon polygon : polygons) {
            List<LinearRing> keptHoles = new ArrayList<>();
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                LinearRing hole = polygon.getInteriorRingN(h);
                if (Area.ofRing(hole.getCoordinateSequence()) >= minHoleArea) {
                    keptHoles.add(hole);
                }
            }
            if (keptHoles.size() == polygon.getNumInteriorRing()) {
                result.add(polygon);
            } else {
                result.add(geometryFactory.createPolygon(
                    polygon.getExteriorRing(), keptHoles.toArray(new LinearRing[0])
                ));
            }
        }
        if (result.size() == 1) {
            return result.get(0);
        }
        return geometryFactory.createMultiPolygon(result.toArray(new Polygon[0]));
    }

}
