package com.jctaxes.geometry;

import org.locationtech.jts.geom.Geometry;

/**
 * One canonical geometry in both of the coordinate systems we need: WGS84 for display and planar feet for area math.
 * The two are always derived from the same decoded source, one of them by reprojecting the other.
 */
public class NormalizedGeometry {

    /** Longitude and latitude, for writing to GeoJSON. */
    public final Geometry wgsGeometry;

    /** State plane feet. Its area is in square feet. */
    public final Geometry planarGeometry;

    /** Which system the source coordinates were believed to be in. */
    public final CrsClassification sourceClassification;

    public NormalizedGeometry (Geometry wgsGeometry, Geometry planarGeometry, CrsClassification sourceClassification) {
        this.wgsGeometry = wgsGeometry;
        this.planarGeometry = planarGeometry;
        this.sourceClassification = sourceClassification;
    }

    public double areaSqft () {
        return planarGeometry.getArea();
    }

}
