package com.jctaxes;

import com.jctaxes.geometry.GeometrySettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaxMapConfigTest {

    @Test
    void defaultsApplyToGeometrySettings (@TempDir File tempDir) {
        TaxMapConfig config = TestData.config(tempDir);
        assertEquals(GeometrySettings.DEFAULT_PLANAR_CRS, config.geometrySettings.planarCrs);
        assertEquals(50, config.geometrySettings.mergeBufferFt);
        assertEquals(200_000, config.geometrySettings.minHoleAreaSqft);
        assertNull(config.omnibusFile);
        assertEquals(tempDir, config.outputDir);
    }

    @Test
    void environmentOverridesFile (@TempDir File tempDir) {
        Properties properties = TestData.properties(tempDir);
        properties.setProperty("merge-buffer-ft", "30");
        Map<String, String> environment = new HashMap<>();
        environment.put("JCTAXES_MERGE_BUFFER_FT", "40");
        environment.put("UNRELATED_VARIABLE", "x");
        Map<String, String> systemProperties = new HashMap<>();
        systemProperties.put("jctaxes.simplify.tolerance.ft", "2.5");
        TaxMapConfig config = new TaxMapConfig(properties, environment, systemProperties);
        assertEquals(40, config.geometrySettings.mergeBufferFt);
        assertEquals(2.5, config.geometrySettings.simplifyToleranceFt);
    }

    @Test
    void systemPropertiesTakePrecedenceOverEnvironment (@TempDir File tempDir) {
        Map<String, String> environment = Collections.singletonMap("JCTAXES_MIN_HOLE_AREA_SQFT", "1000");
        Map<String, String> systemProperties = Collections.singletonMap("jctaxes.min-hole-area-sqft", "2000");
        TaxMapConfig config = new TaxMapConfig(TestData.properties(tempDir), environment, systemProperties);
        assertEquals(2000, config.geometrySettings.minHoleAreaSqft);
    }

    /** Every problem is reported at once rather than one per attempt. */
    @Test
    void allErrorsAreReportedTogether () {
        Properties properties = new Properties();
        properties.setProperty("payments-file", "payments.csv");
        properties.setProperty("merge-buffer-ft", "wide");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TestData.config(properties));
        String message = e.getMessage();
        for (String key : new String[] {"parcels-file", "census-blocks-file", "wards-file", "output-dir", "merge-buffer-ft"}) {
            assertTrue(message.contains(key), "Message should name " + key);
        }
    }

    @Test
    void negativeThresholdIsAnError (@TempDir File tempDir) {
        Properties properties = TestData.properties(tempDir);
        properties.setProperty("simplify-tolerance-ft", "-1");
        assertThrows(IllegalArgumentException.class, () -> TestData.config(properties));
    }

}
