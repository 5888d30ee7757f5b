package com.jctaxes.census;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums the weighted overlay fragments per census block. Every block in the registry gets a row, in registry order,
 * including blocks that received nothing: a zero on the map is information, a missing block is a hole.
 */
public class CensusAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(CensusAggregator.class);

    /** Running sums for one block. */
    private static class Accumulator {
        double paid;
        double billed;
        double areaSqft;
    }

    public List<CensusBlockTotals> aggregate (CensusRegistry registry, List<OverlayFragment> fragments) {
        Map<String, Accumulator> accumulators = new HashMap<>();
        for (OverlayFragment fragment : fragments) {
            Accumulator accumulator = accumulators.computeIfAbsent(fragment.geoid, k -> new Accumulator());
            accumulator.paid += fragment.weightedPaid;
            accumulator.billed += fragment.weightedBilled;
            // Non-paying land is left out of the area so it does not dilute the per-area rate.
            if (fragment.isTaxPaying()) {
                accumulator.areaSqft += fragment.intersectionArea;
            }
        }
        List<CensusBlockTotals> totals = new ArrayList<>(registry.blocks.size());
        int nEmpty = 0;
        for (CensusBlock block : registry.blocks) {
            Accumulator accumulator = accumulators.get(block.geoid);
            if (accumulator == null) {
                nEmpty += 1;
                totals.add(new CensusBlockTotals(block, 0, 0, 0));
            } else {
                totals.add(new CensusBlockTotals(block, accumulator.paid, accumulator.billed, accumulator.areaSqft));
            }
        }
        LOG.info("Aggregated {} overlay fragments into {} census blocks ({} received no payments).",
                fragments.size(), totals.size(), nEmpty);
        return totals;
    }

}
