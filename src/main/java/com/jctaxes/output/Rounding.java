package com.jctaxes.output;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounds values for output. Half-even rounding avoids a systematic upward bias when many rounded values are summed
 * by map consumers. BigDecimal.valueOf uses the shortest decimal representation of the double, so a value like
 * 2.675 rounds as written rather than as its binary approximation.
 */
public abstract class Rounding {

    public static final int CURRENCY_DECIMALS = 2;

    public static final int AREA_DECIMALS = 1;

    public static final int RATE_DECIMALS = 2;

    public static double round (double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite value " + value);
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double currency (double value) {
        return round(value, CURRENCY_DECIMALS);
    }

    public static double area (double value) {
        return round(value, AREA_DECIMALS);
    }

    public static double rate (double value) {
        return round(value, RATE_DECIMALS);
    }

}
