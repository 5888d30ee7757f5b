package com.jctaxes.census;

import com.jctaxes.geometry.Polygons;
import com.jctaxes.lots.LotRecord;
import com.jctaxes.util.SkipCounts;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedPolygon;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits each lot's payment across the census blocks it overlaps, in proportion to overlapping area.
 *
 * Tax parcels and census blocks are surveyed independently and their boundaries do not line up: lots routinely
 * straddle block edges by a few feet, and some large lots span several blocks. So a payment cannot be assigned by
 * looking up which block contains a lot's centroid. Instead every lot is intersected with every block it touches,
 * and each piece gets weight = intersection area / lot area of the lot's payment. This assumes payment is uniform
 * over a lot's footprint, which is an approximation, not an exact attribution.
 *
 * Where the union of census blocks does not cover a lot, the weights of that lot sum to less than one and the
 * uncovered share of its payment is not allocated anywhere. Lots entirely outside the census geography lose their
 * whole payment. Both are logged but deliberately not corrected.
 *
 * All geometries must be in the same planar CRS.
 */
public class OverlayAllocator {

    private static final Logger LOG = LoggerFactory.getLogger(OverlayAllocator.class);

    public static final String ZERO_AREA = "lot has zero area";
    public static final String OUTSIDE_CENSUS = "lot outside all census blocks";
    public static final String OVERLAY_FAILED = "lot/block intersection failed";

    private final STRtree blockIndex = new STRtree();

    private final int nBlocks;

    /** Census block with its geometry prepared for repeated containment tests. */
    private static class IndexedBlock {
        final CensusBlock block;
        final PreparedGeometry prepared;

        IndexedBlock (CensusBlock block) {
            this.block = block;
            this.prepared = new PreparedPolygon((Polygonal) block.planarGeometry);
        }
    }

    public OverlayAllocator (CensusRegistry registry) {
        int n = 0;
        for (CensusBlock block : registry.blocks) {
            if (!(block.planarGeometry instanceof Polygonal) || block.planarGeometry.isEmpty()) {
                LOG.warn("Census block {} has no polygonal geometry and will receive no allocation.", block.geoid);
                continue;
            }
            blockIndex.insert(block.planarGeometry.getEnvelopeInternal(), new IndexedBlock(block));
            n += 1;
        }
        blockIndex.build();
        nBlocks = n;
    }

    public List<OverlayFragment> allocate (List<LotRecord> lots) {
        LOG.info("Intersecting {} lots with {} census blocks...", lots.size(), nBlocks);
        SkipCounts skipCounts = new SkipCounts(LOG, "Census block overlay");
        List<OverlayFragment> fragments = new ArrayList<>();
        double unallocatedPaid = 0;
        for (LotRecord lot : lots) {
            skipCounts.seen();
            if (!(lot.areaSqft > 0)) {
                skipCounts.skipped(ZERO_AREA);
                unallocatedPaid += lot.paid;
                continue;
            }
            List<OverlayFragment> lotFragments = allocate(lot, skipCounts);
            double totalWeight = 0;
            for (OverlayFragment fragment : lotFragments) {
                totalWeight += fragment.weight;
            }
            if (lotFragments.isEmpty()) {
                skipCounts.skipped(OUTSIDE_CENSUS);
            }
            unallocatedPaid += lot.paid * Math.max(0, 1 - totalWeight);
            fragments.addAll(lotFragments);
        }
        skipCounts.logSummary();
        LOG.info("Produced {} overlay fragments. Payment not covered by any census block: {}.",
                fragments.size(), String.format("%.2f", unallocatedPaid));
        return fragments;
    }

    /** The overlay fragments of a single lot. Lots with zero area yield no fragments. */
    public List<OverlayFragment> allocate (LotRecord lot) {
        if (!(lot.areaSqft > 0)) {
            return new ArrayList<>();
        }
        return allocate(lot, new SkipCounts(LOG, "Single lot overlay", 0));
    }

    @SuppressWarnings("unchecked")
    private List<OverlayFragment> allocate (LotRecord lot, SkipCounts skipCounts) {
        List<OverlayFragment> fragments = new ArrayList<>();
        Geometry lotGeometry = lot.planarGeometry;
        List<IndexedBlock> candidates = blockIndex.query(lotGeometry.getEnvelopeInternal());
        for (IndexedBlock candidate : candidates) {
            Geometry intersection;
            // Lot completely within the block: the whole lot is the intersection, no overlay needed.
            // The more common case of a lot straddling a block edge falls through to the full intersection.
            if (candidate.prepared.containsProperly(lotGeometry)) {
                intersection = lotGeometry;
            } else if (candidate.prepared.intersects(lotGeometry)) {
                try {
                    intersection = Polygons.intersection(lotGeometry, candidate.block.planarGeometry);
                } catch (RuntimeException e) {
                    LOG.debug("Intersection of {} and {} failed: {}", lot, candidate.block, e.getMessage());
                    skipCounts.skipped(OVERLAY_FAILED);
                    continue;
                }
            } else {
                continue;
            }
            double intersectionArea = intersection.getArea();
            // Lots merely touching a block yield lines or zero-area slivers, which carry no payment.
            if (!(intersectionArea > 0)) {
                continue;
            }
            double weight = intersectionArea / lot.areaSqft;
            fragments.add(new OverlayFragment(
                lot.key,
                lot.block,
                candidate.block.geoid,
                candidate.block.ward,
                intersection,
                intersectionArea,
                weight,
                lot.paid * weight,
                lot.billed * weight
            ));
        }
        return fragments;
    }

}
