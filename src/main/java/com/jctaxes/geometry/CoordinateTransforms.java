package com.jctaxes.geometry;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pair of fixed coordinate transforms between WGS84 and the planar (feet) CRS used for area math.
 * One instance is created per run and handed to every stage that needs it, rather than being held in static fields.
 * Instances are never modified after construction. The underlying proj4j transforms reuse scratch coordinates
 * internally, so an instance must not be shared between threads; the pipeline is single-threaded.
 */
public class CoordinateTransforms {

    private static final Logger LOG = LoggerFactory.getLogger(CoordinateTransforms.class);

    private static final String WGS84_PARAMETERS = "+proj=longlat +datum=WGS84 +no_defs";

    public final String planarCrsName;

    private final CoordinateTransform wgsToPlanar;

    private final CoordinateTransform planarToWgs;

    private CoordinateTransforms (String planarCrsName, CoordinateTransform wgsToPlanar, CoordinateTransform planarToWgs) {
        this.planarCrsName = planarCrsName;
        this.wgsToPlanar = wgsToPlanar;
        this.planarToWgs = planarToWgs;
    }

    /**
     * @param planarCrs either a name proj4j can resolve (EPSG:3424) or a proj.4 parameter string beginning with +proj
     */
    public static CoordinateTransforms forPlanarCrs (String planarCrs) {
        CRSFactory crsFactory = new CRSFactory();
        CoordinateReferenceSystem wgs = crsFactory.createFromParameters("WGS84", WGS84_PARAMETERS);
        CoordinateReferenceSystem planar;
        try {
            if (planarCrs.trim().startsWith("+")) {
                planar = crsFactory.createFromParameters("planar", planarCrs.trim());
            } else {
                planar = crsFactory.createFromName(planarCrs.trim());
            }
        } catch (Proj4jException e) {
            throw new IllegalArgumentException("Could not resolve planar coordinate reference system " + planarCrs, e);
        }
        LOG.info("Using planar CRS {} ({})", planarCrs, planar.getParameterString());
        CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
        return new CoordinateTransforms(
            planarCrs,
            transformFactory.createTransform(wgs, planar),
            transformFactory.createTransform(planar, wgs)
        );
    }

    public static CoordinateTransforms forSettings (GeometrySettings settings) {
        return forPlanarCrs(settings.planarCrs);
    }

    /** Return a reprojected copy of a WGS84 geometry in planar feet. The input is not modified. */
    public Geometry toPlanar (Geometry wgsGeometry) {
        return transform(wgsGeometry, wgsToPlanar);
    }

    /** Return a reprojected copy of a planar geometry in WGS84 degrees. The input is not modified. */
    public Geometry toWgs84 (Geometry planarGeometry) {
        return transform(planarGeometry, planarToWgs);
    }

    private static Geometry transform (Geometry geometry, CoordinateTransform coordinateTransform) {
        if (geometry == null) {
            return null;
        }
        Geometry copy = geometry.copy();
        copy.apply(new ReprojectingFilter(coordinateTransform));
        copy.geometryChanged();
        return copy;
    }

    /** Rewrites every coordinate of a geometry in place. Only X and Y are transformed. */
    private static class ReprojectingFilter implements CoordinateSequenceFilter {

        private final CoordinateTransform coordinateTransform;

        private final ProjCoordinate source = new ProjCoordinate();

        private final ProjCoordinate target = new ProjCoordinate();

        ReprojectingFilter (CoordinateTransform coordinateTransform) {
            this.coordinateTransform = coordinateTransform;
        }

        @Override
        public void filter (CoordinateSequence sequence, int i) {
            source.x = sequence.getX(i);
            source.y = sequence.getY(i);
            coordinateTransform.transform(source, target);
            sequence.setOrdinate(i, CoordinateSequence.X, target.x);
            sequence.setOrdinate(i, CoordinateSequence.Y, target.y);
        }

        @Override
        public boolean isDone () {
            return false;
        }

        @Override
        public boolean isGeometryChanged () {
            return true;
        }
    }

}
