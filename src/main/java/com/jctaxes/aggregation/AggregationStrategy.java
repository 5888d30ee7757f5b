package com.jctaxes.aggregation;

import com.google.common.collect.ImmutableList;
import com.jctaxes.census.CensusAggregator;
import com.jctaxes.census.CensusBlockTotals;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.census.OverlayAllocator;
import com.jctaxes.census.OverlayFragment;
import com.jctaxes.datasource.Enrichment;
import com.jctaxes.datasource.TaxDataset;
import com.jctaxes.lots.JoinKeys;
import com.jctaxes.lots.LotAggregator;
import com.jctaxes.lots.LotRecord;
import com.jctaxes.lots.NormalizedParcels;
import com.jctaxes.lots.PaymentIndex;
import com.jctaxes.wards.WardAggregator;
import com.jctaxes.wards.WardGeometryBuilder;
import com.jctaxes.wards.WardTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs the stages needed for one aggregation level. All levels share the same pipeline and differ only in how
 * parcels and payments are keyed, whether omnibus payments are split, how far results are rolled up, and which
 * descriptive attributes are attached:
 *
 * <pre>
 * level         keys   omnibus  rollup
 * unit          UNIT   no       none
 * lot           LOT    yes      none
 * block         BLOCK  no       none
 * census-block  LOT    yes      census block
 * ward          LOT    yes      ward
 * </pre>
 */
public class AggregationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationStrategy.class);

    public enum Rollup {
        /** Each dissolved lot (or unit, or block) is a result. */
        NONE,
        /** Lots are split over census blocks, which are the results. */
        CENSUS_BLOCK,
        /** As for census blocks, then rolled up again into wards. */
        WARD
    }

    public final AggregationLevel level;

    public final JoinKeys joinKeys;

    public final boolean omnibus;

    public final Rollup rollup;

    /** Names of the enrichment attributes attached at this level. */
    private final List<String> enrichmentAttributes;

    private AggregationStrategy (
        AggregationLevel level,
        JoinKeys joinKeys,
        boolean omnibus,
        Rollup rollup,
        String... enrichmentAttributes
    ) {
        checkArgument(!omnibus || joinKeys == JoinKeys.LOT, "Omnibus payments can only be split among lots.");
        this.level = level;
        this.joinKeys = joinKeys;
        this.omnibus = omnibus;
        this.rollup = rollup;
        this.enrichmentAttributes = ImmutableList.copyOf(enrichmentAttributes);
    }

    public static AggregationStrategy forLevel (AggregationLevel level) {
        switch (level) {
            case UNIT:
                return new AggregationStrategy(level, JoinKeys.UNIT, false, Rollup.NONE,
                        Enrichment.ADDR, Enrichment.OWNER);
            case LOT:
                return new AggregationStrategy(level, JoinKeys.LOT, true, Rollup.NONE,
                        Enrichment.ADDR, Enrichment.OWNER);
            case BLOCK:
                return new AggregationStrategy(level, JoinKeys.BLOCK, false, Rollup.NONE, Enrichment.STREETS);
            case CENSUS_BLOCK:
                return new AggregationStrategy(level, JoinKeys.LOT, true, Rollup.CENSUS_BLOCK);
            case WARD:
                return new AggregationStrategy(level, JoinKeys.LOT, true, Rollup.WARD);
            default:
                throw new IllegalArgumentException("No aggregation strategy for level " + level);
        }
    }

    /** Whether the census block and ward registries must be loaded for this level. */
    public boolean needsCensus () {
        return rollup != Rollup.NONE;
    }

    public List<PropertyBuilder> propertyBuilders (TaxDataset dataset) {
        List<PropertyBuilder> builders = new ArrayList<>();
        if (!enrichmentAttributes.isEmpty()) {
            builders.add(new EnrichmentPropertyBuilder(dataset.enrichment, enrichmentAttributes.toArray(new String[0])));
        }
        if (rollup == Rollup.WARD) {
            builders.add(new CouncilPersonPropertyBuilder(dataset.censusRegistry));
        }
        return builders;
    }

    /**
     * Compute the results for one tax year.
     * @param wardGeometryBuilder used only at ward level, may be null otherwise.
     */
    public List<AggregateResult> aggregate (
        NormalizedParcels parcels,
        TaxDataset dataset,
        int year,
        WardGeometryBuilder wardGeometryBuilder
    ) {
        LOG.info("Aggregating {} payments to {} level.", year, level);
        PaymentIndex payments = PaymentIndex.build(dataset.payments, year, joinKeys);
        if (omnibus) {
            payments = payments.withOmnibusRedistribution(dataset.omnibusTable);
        }
        List<LotRecord> lots = new LotAggregator(joinKeys).aggregate(parcels, payments);

        List<AggregateResult> results;
        if (rollup == Rollup.NONE) {
            results = lotResults(lots);
        } else {
            CensusRegistry registry = checkNotNull(dataset.censusRegistry, "Census registry was not loaded.");
            List<OverlayFragment> fragments = new OverlayAllocator(registry).allocate(lots);
            List<CensusBlockTotals> blockTotals = new CensusAggregator().aggregate(registry, fragments);
            if (rollup == Rollup.CENSUS_BLOCK) {
                results = censusBlockResults(blockTotals);
            } else {
                checkNotNull(wardGeometryBuilder, "Ward geometries cannot be built without a geometry builder.");
                List<WardTotals> wardTotals =
                        new WardAggregator(wardGeometryBuilder).aggregate(registry, blockTotals, fragments);
                results = wardResults(wardTotals);
            }
        }

        for (PropertyBuilder builder : propertyBuilders(dataset)) {
            for (AggregateResult result : results) {
                builder.addProperties(result);
            }
        }
        LOG.info("Produced {} {} results.", results.size(), level);
        return results;
    }

    private static List<AggregateResult> lotResults (List<LotRecord> lots) {
        List<AggregateResult> results = new ArrayList<>(lots.size());
        for (LotRecord lot : lots) {
            AggregateResult result = new AggregateResult(lot.key, lot.wgsGeometry, lot.paid, lot.billed, lot.areaSqft, null);
            result.withAttribute("block", lot.block)
                  .withAttribute("lot", lot.lot)
                  .withAttribute("qual", lot.qualifier);
            results.add(result);
        }
        return results;
    }

    private static List<AggregateResult> censusBlockResults (List<CensusBlockTotals> blockTotals) {
        List<AggregateResult> results = new ArrayList<>(blockTotals.size());
        for (CensusBlockTotals totals : blockTotals) {
            AggregateResult result = new AggregateResult(
                totals.block.geoid,
                totals.block.wgsGeometry,
                totals.paid,
                totals.billed,
                totals.areaSqft,
                totals.block.population
            );
            result.withAttribute("geoid", totals.block.geoid)
                  .withAttribute("ward", totals.block.ward);
            results.add(result);
        }
        return results;
    }

    private static List<AggregateResult> wardResults (List<WardTotals> wardTotals) {
        List<AggregateResult> results = new ArrayList<>(wardTotals.size());
        for (WardTotals totals : wardTotals) {
            AggregateResult result = new AggregateResult(
                totals.ward.id,
                totals.displayGeometry(),
                totals.paid,
                totals.billed,
                totals.areaSqft,
                totals.population
            );
            result.withAttribute("ward", totals.ward.id)
                  .withAuxiliaryGeometry("lots", totals.trimmedFootprint)
                  .withAuxiliaryGeometry("blocks", totals.blockOutline)
                  .withAuxiliaryGeometry("boundary", totals.ward.wgsGeometry);
            results.add(result);
        }
        return results;
    }

}
