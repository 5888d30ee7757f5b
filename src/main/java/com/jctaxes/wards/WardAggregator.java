package com.jctaxes.wards;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.jctaxes.census.CensusBlockTotals;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.census.OverlayFragment;
import com.jctaxes.census.Ward;
import com.jctaxes.util.SkipCounts;
import gnu.trove.map.TObjectDoubleMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectDoubleHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolls census block totals up to wards, and builds the shapes drawn for each ward from the overlay fragments that
 * fell inside it. Every ward in the registry produces a row, in registry order. Census blocks assigned to a ward the
 * registry does not know about are excluded from all wards.
 */
public class WardAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(WardAggregator.class);

    public static final String NO_WARD = "census block not assigned to any ward";
    public static final String UNKNOWN_WARD = "census block assigned to a ward missing from the registry";

    private final WardGeometryBuilder geometryBuilder;

    public WardAggregator (WardGeometryBuilder geometryBuilder) {
        this.geometryBuilder = geometryBuilder;
    }

    public List<WardTotals> aggregate (
        CensusRegistry registry,
        List<CensusBlockTotals> blockTotals,
        List<OverlayFragment> fragments
    ) {
        SkipCounts skipCounts = new SkipCounts(LOG, "Ward rollup", 0);
        TObjectDoubleMap<String> paid = new TObjectDoubleHashMap<>();
        TObjectDoubleMap<String> billed = new TObjectDoubleHashMap<>();
        TObjectDoubleMap<String> area = new TObjectDoubleHashMap<>();
        TObjectIntMap<String> population = new TObjectIntHashMap<>();
        for (CensusBlockTotals totals : blockTotals) {
            skipCounts.seen();
            String wardId = totals.block.ward;
            if (wardId == null) {
                skipCounts.skipped(NO_WARD);
                continue;
            }
            if (registry.getWard(wardId) == null) {
                LOG.debug("Excluding {}, its ward {} is not in the registry.", totals.block, wardId);
                skipCounts.skipped(UNKNOWN_WARD);
                continue;
            }
            paid.adjustOrPutValue(wardId, totals.paid, totals.paid);
            billed.adjustOrPutValue(wardId, totals.billed, totals.billed);
            area.adjustOrPutValue(wardId, totals.areaSqft, totals.areaSqft);
            population.adjustOrPutValue(wardId, totals.block.population, totals.block.population);
        }
        skipCounts.logSummary();

        ListMultimap<String, OverlayFragment> fragmentsByWard =
                MultimapBuilder.hashKeys().arrayListValues().build();
        for (OverlayFragment fragment : fragments) {
            if (fragment.ward != null && registry.getWard(fragment.ward) != null) {
                fragmentsByWard.put(fragment.ward, fragment);
            }
        }

        List<WardTotals> wardTotals = new ArrayList<>(registry.wards.size());
        for (Ward ward : registry.wards) {
            List<OverlayFragment> wardFragments = fragmentsByWard.get(ward.id);
            Geometry merged = null;
            Geometry trimmed = null;
            Geometry blocks = null;
            if (!wardFragments.isEmpty()) {
                LOG.info("Building geometries for {} from {} lot fragments...", ward, wardFragments.size());
                merged = geometryBuilder.toWgs84(geometryBuilder.mergedBoundary(wardFragments));
                trimmed = geometryBuilder.toWgs84(geometryBuilder.trimmedFootprint(wardFragments));
                blocks = geometryBuilder.toWgs84(geometryBuilder.blockOutline(wardFragments));
            } else {
                LOG.warn("No lots fall within {}, drawing its registry boundary.", ward);
            }
            // Trove maps return zero for missing keys, which is the right total for a ward without blocks.
            wardTotals.add(new WardTotals(
                ward,
                paid.get(ward.id),
                billed.get(ward.id),
                population.get(ward.id),
                area.get(ward.id),
                merged,
                trimmed,
                blocks
            ));
        }
        return wardTotals;
    }

}
