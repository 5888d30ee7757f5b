package com.jctaxes.lots;

import org.locationtech.jts.geom.Geometry;

/**
 * A tax-paying parcel after its fragments have been dissolved, with the payment joined onto it.
 * Depending on the join keys in use this represents a condominium unit, a lot, or a whole city block.
 */
public class LotRecord {

    public final String key;

    public final String block;

    /** Null at block granularity. */
    public final String lot;

    /** Null except at unit granularity. */
    public final String qualifier;

    public final Geometry planarGeometry;

    public final Geometry wgsGeometry;

    /** Area of the planar geometry in square feet. */
    public final double areaSqft;

    public final double paid;

    public final double billed;

    public LotRecord (
        String key,
        String block,
        String lot,
        String qualifier,
        Geometry planarGeometry,
        Geometry wgsGeometry,
        Payment payment
    ) {
        this.key = key;
        this.block = block;
        this.lot = lot;
        this.qualifier = qualifier;
        this.planarGeometry = planarGeometry;
        this.wgsGeometry = wgsGeometry;
        this.areaSqft = planarGeometry.getArea();
        this.paid = payment.paid;
        this.billed = payment.billed;
    }

    @Override
    public String toString () {
        return String.format("lot %s (%.0f sqft, paid %.2f)", key, areaSqft, paid);
    }

}
