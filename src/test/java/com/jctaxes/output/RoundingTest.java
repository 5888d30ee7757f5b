package com.jctaxes.output;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RoundingTest {

    @ParameterizedTest
    @CsvSource({
        "40000.004, 2, 40000.0",
        "0.125,     2, 0.12",
        "0.135,     2, 0.14",
        "2.675,     2, 2.68",
        "1234.25,   1, 1234.2",
        "1234.35,   1, 1234.4",
        "-0.015,    2, -0.02",
    })
    void halfEven (double value, int decimals, double expected) {
        assertEquals(expected, Rounding.round(value, decimals));
    }

}
