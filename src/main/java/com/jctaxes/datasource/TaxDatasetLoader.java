package com.jctaxes.datasource;

import com.jctaxes.TaxMapConfig;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.lots.OmnibusTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;

/**
 * Loads the inputs of a run. Each input is produced by an earlier step of the data preparation, and all required
 * files are checked before any is read, so that a missing prerequisite fails fast with a message saying which step
 * to run.
 */
public class TaxDatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TaxDatasetLoader.class);

    private final TaxMapConfig config;

    private final GeometryNormalizer normalizer;

    public TaxDatasetLoader (TaxMapConfig config, GeometryNormalizer normalizer) {
        this.config = config;
        this.normalizer = normalizer;
    }

    /**
     * @param includeCensus whether the census block and ward registries are needed and must be read.
     * @throws PrerequisiteMissingException if a required input file does not exist.
     */
    public TaxDataset load (boolean includeCensus) {
        checkExists("Payment ledger", config.paymentsFile, "payment scraping");
        checkExists("Parcel geometries", config.parcelsFile, "parcel download");
        if (includeCensus) {
            checkExists("Census block registry", config.censusBlocksFile, "census block preparation");
            checkExists("Ward registry", config.wardsFile, "ward assignment");
        }

        List<PaymentRecord> payments = PaymentLedgerReader.read(config.paymentsFile);
        List<ParcelFragment> parcels = ParcelReader.read(config.parcelsFile);
        CensusRegistry registry = null;
        if (includeCensus) {
            registry = new CensusRegistryReader(normalizer).read(config.censusBlocksFile, config.wardsFile);
        }
        Enrichment enrichment = Enrichment.EMPTY;
        if (config.enrichmentFile != null) {
            if (config.enrichmentFile.exists()) {
                enrichment = EnrichmentReader.read(config.enrichmentFile);
            } else {
                LOG.warn("Enrichment file {} does not exist, output will lack addresses and owners.",
                        config.enrichmentFile);
            }
        }
        OmnibusTable omnibusTable;
        if (config.omnibusFile != null) {
            checkExists("Omnibus table", config.omnibusFile, "omnibus table curation");
            omnibusTable = OmnibusTable.fromFile(config.omnibusFile);
        } else {
            omnibusTable = OmnibusTable.fromClasspath();
        }
        return new TaxDataset(parcels, payments, registry, enrichment, omnibusTable);
    }

    private static void checkExists (String description, File file, String producingStep) {
        if (file == null || !file.exists()) {
            throw new PrerequisiteMissingException(description, file, producingStep);
        }
    }

}
