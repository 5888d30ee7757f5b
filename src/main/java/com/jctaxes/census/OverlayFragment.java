package com.jctaxes.census;

import org.locationtech.jts.geom.Geometry;

/**
 * The piece of one lot that falls inside one census block, carrying the corresponding share of the lot's payment.
 * The share is proportional to area: payment is assumed to be spread uniformly over a lot's footprint.
 */
public class OverlayFragment {

    public final String lotKey;

    /** City block of the lot, used to build block-level outlines within a ward. */
    public final String cityBlock;

    public final String geoid;

    public final String ward;

    /** Planar intersection of the lot and census block geometries. */
    public final Geometry geometry;

    public final double intersectionArea;

    /** Fraction of the lot's area inside this census block, in (0, 1]. */
    public final double weight;

    public final double weightedPaid;

    public final double weightedBilled;

    public OverlayFragment (
        String lotKey,
        String cityBlock,
        String geoid,
        String ward,
        Geometry geometry,
        double intersectionArea,
        double weight,
        double weightedPaid,
        double weightedBilled
    ) {
        this.lotKey = lotKey;
        this.cityBlock = cityBlock;
        this.geoid = geoid;
        this.ward = ward;
        this.geometry = geometry;
        this.intersectionArea = intersectionArea;
        this.weight = weight;
        this.weightedPaid = weightedPaid;
        this.weightedBilled = weightedBilled;
    }

    /** Parks, open space and water pay nothing, and are excluded from per-area denominators. */
    public boolean isTaxPaying () {
        return weightedPaid > 0;
    }

}
