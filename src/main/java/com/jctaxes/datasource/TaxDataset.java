package com.jctaxes.datasource;

import com.jctaxes.census.CensusRegistry;
import com.jctaxes.lots.OmnibusTable;

import java.util.List;

/** Everything read from disk for one run, before any processing. */
public class TaxDataset {

    public final List<ParcelFragment> parcels;

    public final List<PaymentRecord> payments;

    /** Null when the aggregation level does not need census geography. */
    public final CensusRegistry censusRegistry;

    public final Enrichment enrichment;

    public final OmnibusTable omnibusTable;

    public TaxDataset (
        List<ParcelFragment> parcels,
        List<PaymentRecord> payments,
        CensusRegistry censusRegistry,
        Enrichment enrichment,
        OmnibusTable omnibusTable
    ) {
        this.parcels = parcels;
        this.payments = payments;
        this.censusRegistry = censusRegistry;
        this.enrichment = enrichment;
        this.omnibusTable = omnibusTable;
    }

}
