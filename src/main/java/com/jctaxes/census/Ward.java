package com.jctaxes.census;

import org.locationtech.jts.geom.Geometry;

/** An electoral ward with its official boundary. Read only. */
public class Ward {

    public final String id;

    public final String councilPerson;

    /** The authoritative registry boundary in WGS84. */
    public final Geometry wgsGeometry;

    public Ward (String id, String councilPerson, Geometry wgsGeometry) {
        this.id = id;
        this.councilPerson = councilPerson;
        this.wgsGeometry = wgsGeometry;
    }

    @Override
    public String toString () {
        return "ward " + id;
    }

}
