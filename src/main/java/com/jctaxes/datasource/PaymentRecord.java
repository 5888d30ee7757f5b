package com.jctaxes.datasource;

/**
 * Yearly billed and paid totals for one tax account, identified by block, lot and qualifier.
 * Condominium buildings have one record per unit, which are summed when aggregating to lots.
 */
public class PaymentRecord {

    public final String block;

    public final String lot;

    public final String qualifier;

    public final int year;

    public final double billed;

    /** Always non-negative. The billing system reports payments as negative amounts. */
    public final double paid;

    public PaymentRecord (String block, String lot, String qualifier, int year, double billed, double paid) {
        this.block = ParcelFragment.clean(block);
        this.lot = ParcelFragment.clean(lot);
        this.qualifier = ParcelFragment.clean(qualifier);
        this.year = year;
        this.billed = billed;
        this.paid = Math.abs(paid);
    }

}
