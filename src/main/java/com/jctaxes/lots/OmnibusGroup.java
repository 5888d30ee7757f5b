package com.jctaxes.lots;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry in the omnibus override table: a single billing record (the source lot) whose payment actually covers
 * several legally distinct lots. This happens for urban renewal complexes billed under one certificate.
 * Deserialized from JSON, hence the public mutable fields.
 */
public class OmnibusGroup {

    /** The block-lot key that carries the combined payment in the ledger. */
    public String source;

    /** Every block-lot key the payment covers, including the source itself. */
    public List<String> lots = new ArrayList<>();

    /** Free text explaining where this grouping comes from. Not used in any computation. */
    public String description;

    public OmnibusGroup () { }

    public OmnibusGroup (String source, List<String> lots) {
        this.source = source;
        this.lots = new ArrayList<>(lots);
    }

    /** A copy whose list of lots cannot be modified. */
    OmnibusGroup immutableCopy () {
        OmnibusGroup copy = new OmnibusGroup();
        copy.source = source;
        copy.lots = ImmutableList.copyOf(lots);
        copy.description = description;
        return copy;
    }

    @Override
    public String toString () {
        return "omnibus " + source + " -> " + lots;
    }

}
