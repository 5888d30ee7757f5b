package com.jctaxes.lots;

import com.google.common.collect.ImmutableList;
import com.jctaxes.datasource.ParcelFragment;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.geometry.GeometryParseException;
import com.jctaxes.geometry.MissingGeometryException;
import com.jctaxes.geometry.NormalizedGeometry;
import com.jctaxes.util.SkipCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The outcome of normalizing every fragment of the parcel source: those that succeeded, and those whose geometry
 * could not be parsed. The failures are retained because a lot with an unparseable fragment is dropped as a whole
 * rather than being rendered with a piece missing.
 */
public class NormalizedParcels {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizedParcels.class);

    public static final String MISSING_GEOMETRY = "missing geometry";
    public static final String UNPARSEABLE_GEOMETRY = "unparseable geometry";
    public static final String AMBIGUOUS_CRS = "ambiguous reference system (processed anyway)";

    public final List<NormalizedFragment> fragments;

    public final List<ParcelFragment> unparseable;

    public final SkipCounts skipCounts;

    private NormalizedParcels (List<NormalizedFragment> fragments, List<ParcelFragment> unparseable, SkipCounts skipCounts) {
        this.fragments = ImmutableList.copyOf(fragments);
        this.unparseable = ImmutableList.copyOf(unparseable);
        this.skipCounts = skipCounts;
    }

    public static NormalizedParcels normalize (List<ParcelFragment> parcelFragments, GeometryNormalizer normalizer) {
        SkipCounts skipCounts = new SkipCounts(LOG, "Normalizing parcel geometries");
        List<NormalizedFragment> fragments = new ArrayList<>(parcelFragments.size());
        List<ParcelFragment> unparseable = new ArrayList<>();
        for (ParcelFragment fragment : parcelFragments) {
            skipCounts.seen();
            try {
                if (fragment.geometryError != null) {
                    throw new GeometryParseException(fragment.geometryError);
                }
                if (fragment.rawGeometry == null) {
                    throw new MissingGeometryException("No geometry on " + fragment);
                }
                NormalizedGeometry geometry = normalizer.normalize(fragment.rawGeometry);
                if (geometry.sourceClassification.ambiguous) {
                    skipCounts.skipped(AMBIGUOUS_CRS);
                }
                fragments.add(new NormalizedFragment(fragment, geometry));
            } catch (MissingGeometryException e) {
                skipCounts.skipped(MISSING_GEOMETRY);
            } catch (GeometryParseException e) {
                LOG.debug("Skipping {}: {}", fragment, e.getMessage());
                skipCounts.skipped(UNPARSEABLE_GEOMETRY);
                unparseable.add(fragment);
            }
        }
        skipCounts.logSummary();
        return new NormalizedParcels(fragments, unparseable, skipCounts);
    }

    /** For callers that already hold decoded geometries, such as tests and alternative readers. */
    public static NormalizedParcels of (List<NormalizedFragment> fragments, List<ParcelFragment> unparseable) {
        return new NormalizedParcels(fragments, unparseable, new SkipCounts(LOG, "Pre-normalized parcels"));
    }

}
