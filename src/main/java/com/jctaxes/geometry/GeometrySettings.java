package com.jctaxes.geometry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thresholds and distances used when normalizing and reshaping geometries. All of these were chosen empirically for
 * Jersey City parcel geometry and street widths, and are supplied through configuration rather than hard-coded so
 * the engine can be pointed at another city. Distances and areas are in planar CRS units (US survey feet).
 */
public class GeometrySettings {

    /** NJ State Plane, NAD83, US survey feet. */
    public static final String DEFAULT_PLANAR_CRS = "EPSG:3424";

    /**
     * An envelope whose minimum X exceeds this is assumed to already be in planar feet. State plane eastings in New
     * Jersey are in the hundreds of thousands while longitudes never exceed 180 in magnitude.
     */
    public static final double DEFAULT_PROJECTED_MIN_X = 1000;

    /** Visually negligible at typical map zoom, but removes most of the vertices left over from dissolving. */
    public static final double DEFAULT_SIMPLIFY_TOLERANCE_FT = 5;

    /** Roughly a curb-to-curb street width, so lots facing each other across a street fuse into one shape. */
    public static final double DEFAULT_MERGE_BUFFER_FT = 50;

    /** About five acres. Smaller holes are street artifacts, larger ones are parks, reservoirs and the like. */
    public static final double DEFAULT_MIN_HOLE_AREA_SQFT = 200_000;

    /** A CRS name understood by proj4j (e.g. EPSG:3424) or a proj.4 parameter string starting with +proj. */
    public final String planarCrs;

    public final double projectedMinX;

    public final double simplifyToleranceFt;

    public final double mergeBufferFt;

    public final double minHoleAreaSqft;

    public GeometrySettings (
        String planarCrs,
        double projectedMinX,
        double simplifyToleranceFt,
        double mergeBufferFt,
        double minHoleAreaSqft
    ) {
        this.planarCrs = checkNotNull(planarCrs, "A planar coordinate reference system must be specified.");
        checkArgument(simplifyToleranceFt >= 0, "Simplification tolerance must not be negative.");
        checkArgument(mergeBufferFt >= 0, "Merge buffer distance must not be negative.");
        checkArgument(minHoleAreaSqft >= 0, "Minimum hole area must not be negative.");
        this.projectedMinX = projectedMinX;
        this.simplifyToleranceFt = simplifyToleranceFt;
        this.mergeBufferFt = mergeBufferFt;
        this.minHoleAreaSqft = minHoleAreaSqft;
    }

    public static GeometrySettings defaults () {
        return new GeometrySettings(
            DEFAULT_PLANAR_CRS,
            DEFAULT_PROJECTED_MIN_X,
            DEFAULT_SIMPLIFY_TOLERANCE_FT,
            DEFAULT_MERGE_BUFFER_FT,
            DEFAULT_MIN_HOLE_AREA_SQFT
        );
    }

    @Override
    public String toString () {
        return String.format(
            "GeometrySettings[crs=%s, projectedMinX=%s, simplify=%s ft, buffer=%s ft, minHole=%s sqft]",
            planarCrs, projectedMinX, simplifyToleranceFt, mergeBufferFt, minHoleAreaSqft
        );
    }

}
