package com.jctaxes.lots;

/** Paid and billed amounts in dollars. Immutable. */
public class Payment {

    public static final Payment ZERO = new Payment(0, 0);

    public final double paid;

    public final double billed;

    public Payment (double paid, double billed) {
        this.paid = paid;
        this.billed = billed;
    }

    public Payment plus (Payment other) {
        return new Payment(paid + other.paid, billed + other.billed);
    }

    public Payment dividedBy (int n) {
        return new Payment(paid / n, billed / n);
    }

    @Override
    public String toString () {
        return String.format("paid %.2f billed %.2f", paid, billed);
    }

}
