package com.jctaxes.wards;

import com.jctaxes.census.Ward;
import com.jctaxes.util.Rates;
import org.locationtech.jts.geom.Geometry;

import java.util.OptionalDouble;

/**
 * The sums of the census blocks in one ward, along with the shapes used to draw it. All geometries are WGS84.
 */
public class WardTotals {

    public final Ward ward;

    public final double paid;

    public final double billed;

    public final int population;

    public final double areaSqft;

    /**
     * The lots of the ward fused across streets with small holes filled. This is the shape normally drawn.
     * Null if no lot fell within the ward.
     */
    public final Geometry mergedBoundary;

    /** Union of the tax-paying lot pieces, empty if none pay. Null if no lot fell within the ward. */
    public final Geometry trimmedFootprint;

    /** One shape per city block, null if no lot fell within the ward. */
    public final Geometry blockOutline;

    public WardTotals (
        Ward ward,
        double paid,
        double billed,
        int population,
        double areaSqft,
        Geometry mergedBoundary,
        Geometry trimmedFootprint,
        Geometry blockOutline
    ) {
        this.ward = ward;
        this.paid = paid;
        this.billed = billed;
        this.population = population;
        this.areaSqft = areaSqft;
        this.mergedBoundary = mergedBoundary;
        this.trimmedFootprint = trimmedFootprint;
        this.blockOutline = blockOutline;
    }

    /** The shape to draw: the merged boundary, or the registry boundary for a ward without any lots. */
    public Geometry displayGeometry () {
        return mergedBoundary != null ? mergedBoundary : ward.wgsGeometry;
    }

    public double paidPerSqft () {
        return Rates.perSqft(paid, areaSqft);
    }

    public OptionalDouble paidPerCapita () {
        return Rates.perCapita(paid, population);
    }

}
