package com.jctaxes.util;

import java.util.OptionalDouble;

/**
 * Per-area and per-capita rates. Empty parcels (parks, water) and unpopulated blocks are common, so a zero
 * denominator is an expected case rather than an error, and must never produce NaN or infinity in the output.
 */
public abstract class Rates {

    /** @return amount / areaSqft, or zero when there is no tax-paying area. */
    public static double perSqft (double amount, double areaSqft) {
        return areaSqft > 0 ? amount / areaSqft : 0;
    }

    /** @return amount / population, or empty when nobody lives there. */
    public static OptionalDouble perCapita (double amount, int population) {
        return population > 0 ? OptionalDouble.of(amount / population) : OptionalDouble.empty();
    }

}
