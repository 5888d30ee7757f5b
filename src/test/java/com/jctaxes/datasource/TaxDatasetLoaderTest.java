package com.jctaxes.datasource;

import com.jctaxes.TestData;
import com.jctaxes.TaxMapConfig;
import com.jctaxes.geometry.CoordinateTransforms;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.geometry.GeometrySettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaxDatasetLoaderTest {

    private final GeometryNormalizer normalizer = new GeometryNormalizer(
        CoordinateTransforms.forSettings(GeometrySettings.defaults()), GeometrySettings.defaults()
    );

    @Test
    void loadEverything (@TempDir File tempDir) {
        TaxDataset dataset = new TaxDatasetLoader(TestData.config(tempDir), normalizer).load(true);
        assertEquals(7, dataset.parcels.size());
        assertEquals(6, dataset.payments.size());
        assertNotNull(dataset.censusRegistry);
        assertEquals("1 Grove St", dataset.enrichment.get("100-5", Enrichment.ADDR));
        assertEquals("Grove St, Newark Ave", dataset.enrichment.get("100", Enrichment.STREETS));
        assertNull(dataset.enrichment.get("100", Enrichment.OWNER));
        assertEquals(1, dataset.omnibusTable.groups.size());
    }

    @Test
    void censusIsOnlyLoadedWhenNeeded (@TempDir File tempDir) {
        Properties properties = TestData.properties(tempDir);
        properties.setProperty("census-blocks-file", new File(tempDir, "absent.geojson").getPath());
        TaxMapConfig config = TestData.config(properties);
        TaxDataset dataset = new TaxDatasetLoader(config, normalizer).load(false);
        assertNull(dataset.censusRegistry);
        PrerequisiteMissingException e = assertThrows(PrerequisiteMissingException.class,
                () -> new TaxDatasetLoader(config, normalizer).load(true));
        assertEquals("census block preparation", e.producingStep);
    }

    @Test
    void missingLedgerNamesProducingStep (@TempDir File tempDir) {
        Properties properties = TestData.properties(tempDir);
        File absent = new File(tempDir, "payments.csv");
        properties.setProperty("payments-file", absent.getPath());
        PrerequisiteMissingException e = assertThrows(PrerequisiteMissingException.class,
                () -> new TaxDatasetLoader(TestData.config(properties), normalizer).load(false));
        assertEquals(absent, e.missingFile);
        assertTrue(e.getMessage().contains("payment scraping"));
        assertTrue(e instanceof DataSourceException);
    }

    @Test
    void missingEnrichmentIsNotFatal (@TempDir File tempDir) {
        Properties properties = TestData.properties(tempDir);
        properties.setProperty("enrichment-file", new File(tempDir, "absent.csv").getPath());
        TaxDataset dataset = new TaxDatasetLoader(TestData.config(properties), normalizer).load(false);
        assertEquals(0, dataset.enrichment.size());
    }

}
