package com.jctaxes.census;

import org.locationtech.jts.geom.Geometry;

/** A census block from the registry, already assigned to a ward. Read only. */
public class CensusBlock {

    public final String geoid;

    public final int population;

    /** Null if the registry could not assign this block to a ward. */
    public final String ward;

    public final Geometry wgsGeometry;

    public final Geometry planarGeometry;

    public CensusBlock (String geoid, int population, String ward, Geometry wgsGeometry, Geometry planarGeometry) {
        this.geoid = geoid;
        this.population = population;
        this.ward = ward;
        this.wgsGeometry = wgsGeometry;
        this.planarGeometry = planarGeometry;
    }

    @Override
    public String toString () {
        return "census block " + geoid;
    }

}
