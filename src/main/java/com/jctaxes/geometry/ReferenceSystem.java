package com.jctaxes.geometry;

/**
 * The two coordinate reference systems an input geometry can be in. We never receive CRS metadata with parcel
 * geometries, so which one applies is guessed from coordinate magnitudes, see {@link CrsClassification}.
 */
public enum ReferenceSystem {
    /** Longitude and latitude in degrees (WGS84). */
    GEOGRAPHIC,
    /** Projected state plane coordinates in feet. Areas are square feet. */
    PLANAR
}
