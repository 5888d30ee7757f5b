package com.jctaxes.lots;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.jctaxes.datasource.ParcelFragment;
import com.jctaxes.geometry.Polygons;
import com.jctaxes.util.SkipCounts;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Dissolves parcel fragments sharing a join key into one geometry per key, and attaches the payment for that key.
 *
 * Condominium buildings appear in the parcel source as one fragment per unit, all with the same block and lot. At lot
 * granularity these are unioned into the footprint of the lot, and the payment ledger rows for the units are summed
 * (see {@link PaymentIndex#build}). The same machinery dissolves lots into city blocks, or (when several source rows
 * share a unit key) unit fragments into units.
 *
 * Problems with individual lots never propagate to the caller: a lot with any fragment that could not be parsed, or
 * whose union fails, is dropped and counted.
 */
public class LotAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(LotAggregator.class);

    public static final String MISSING_IDENTIFIERS = "fragment lacks identifiers for its join key";
    public static final String UNPARSEABLE_FRAGMENT = "lot dropped, one of its fragments is unparseable";
    public static final String DISSOLVE_FAILED = "lot dropped, union of its fragments failed";

    private final JoinKeys joinKeys;

    public LotAggregator (JoinKeys joinKeys) {
        this.joinKeys = joinKeys;
    }

    public List<LotRecord> aggregate (NormalizedParcels parcels, PaymentIndex payments) {
        checkArgument(payments.joinKeys == joinKeys,
                "Payments are keyed on %s but lots are being grouped on %s", payments.joinKeys, joinKeys);
        SkipCounts skipCounts = new SkipCounts(LOG, "Dissolving " + joinKeys + " geometries", 0);

        Set<String> unparseableKeys = new HashSet<>();
        for (ParcelFragment fragment : parcels.unparseable) {
            String key = joinKeys.of(fragment);
            if (key != null && unparseableKeys.add(key)) {
                skipCounts.skipped(UNPARSEABLE_FRAGMENT);
            }
        }

        ListMultimap<String, NormalizedFragment> fragmentsByKey =
                MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (NormalizedFragment normalized : parcels.fragments) {
            String key = joinKeys.of(normalized.fragment);
            if (key == null) {
                skipCounts.skipped(MISSING_IDENTIFIERS);
                continue;
            }
            if (!unparseableKeys.contains(key)) {
                fragmentsByKey.put(key, normalized);
            }
        }

        List<LotRecord> lots = new ArrayList<>(fragmentsByKey.keySet().size());
        for (String key : fragmentsByKey.keySet()) {
            skipCounts.seen();
            List<NormalizedFragment> fragments = fragmentsByKey.get(key);
            LotRecord lot;
            try {
                lot = dissolve(key, fragments, payments.get(key));
            } catch (RuntimeException e) {
                LOG.debug("Could not dissolve {} fragments of {}: {}", fragments.size(), key, e.getMessage());
                skipCounts.skipped(DISSOLVE_FAILED);
                continue;
            }
            lots.add(lot);
        }
        skipCounts.logSummary();
        logUnmappedPayments(lots, payments);
        return lots;
    }

    private LotRecord dissolve (String key, List<NormalizedFragment> fragments, Payment payment) {
        ParcelFragment first = fragments.get(0).fragment;
        Geometry planar;
        Geometry wgs;
        if (fragments.size() == 1) {
            planar = fragments.get(0).geometry.planarGeometry;
            wgs = fragments.get(0).geometry.wgsGeometry;
        } else {
            List<Geometry> planarParts = new ArrayList<>(fragments.size());
            List<Geometry> wgsParts = new ArrayList<>(fragments.size());
            for (NormalizedFragment fragment : fragments) {
                planarParts.add(fragment.geometry.planarGeometry);
                wgsParts.add(fragment.geometry.wgsGeometry);
            }
            planar = Polygons.dissolve(planarParts);
            wgs = Polygons.dissolve(wgsParts);
        }
        return new LotRecord(
            key,
            first.block,
            joinKeys == JoinKeys.BLOCK ? null : first.lot,
            joinKeys == JoinKeys.UNIT ? first.qualifier : null,
            planar,
            wgs,
            payment
        );
    }

    /**
     * Payments whose key has no geometry cannot be placed on the map. This is expected for a handful of accounts
     * (personal property, retired lots) but a large total here usually means the join keys are malformed.
     */
    private static void logUnmappedPayments (List<LotRecord> lots, PaymentIndex payments) {
        Set<String> mappedKeys = new HashSet<>();
        for (LotRecord lot : lots) {
            mappedKeys.add(lot.key);
        }
        int nUnmapped = 0;
        Payment unmapped = Payment.ZERO;
        for (String key : payments.keys()) {
            if (!mappedKeys.contains(key)) {
                nUnmapped += 1;
                unmapped = unmapped.plus(payments.get(key));
            }
        }
        if (nUnmapped > 0) {
            LOG.info("{} of {} payment keys have no parcel geometry ({} not mapped).",
                    nUnmapped, payments.size(), unmapped);
        }
    }

}
