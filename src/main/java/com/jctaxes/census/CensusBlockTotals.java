package com.jctaxes.census;

import com.jctaxes.util.Rates;

import java.util.OptionalDouble;

/** The payments allocated to one census block, with the block's own attributes. */
public class CensusBlockTotals {

    public final CensusBlock block;

    public final double paid;

    public final double billed;

    /** Area of the tax-paying overlay fragments inside this block, in square feet. */
    public final double areaSqft;

    public CensusBlockTotals (CensusBlock block, double paid, double billed, double areaSqft) {
        this.block = block;
        this.paid = paid;
        this.billed = billed;
        this.areaSqft = areaSqft;
    }

    public double paidPerSqft () {
        return Rates.perSqft(paid, areaSqft);
    }

    public OptionalDouble paidPerCapita () {
        return Rates.perCapita(paid, block.population);
    }

    @Override
    public String toString () {
        return String.format("%s (paid %.2f over %.0f sqft)", block, paid, areaSqft);
    }

}
