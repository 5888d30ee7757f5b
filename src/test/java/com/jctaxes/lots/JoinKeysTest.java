package com.jctaxes.lots;

import com.jctaxes.datasource.PaymentRecord;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JoinKeysTest {

    @ParameterizedTest
    @CsvSource({
        "UNIT,  100, 5, C0001, 100-5-C0001",
        "UNIT,  100, 5,      , 100-5-",
        "LOT,   100, 5, C0001, 100-5",
        "LOT,   100, 5,      , 100-5",
        "BLOCK, 100, 5, C0001, 100",
    })
    void keys (JoinKeys joinKeys, String block, String lot, String qual, String expected) {
        PaymentRecord record = new PaymentRecord(block, lot, qual, 2024, 0, 0);
        assertEquals(expected, joinKeys.of(record));
    }

    @ParameterizedTest
    @CsvSource({"UNIT", "LOT"})
    void missingLotHasNoKey (JoinKeys joinKeys) {
        assertNull(joinKeys.of(new PaymentRecord("100", " ", null, 2024, 0, 0)));
    }

}
