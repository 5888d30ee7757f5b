package com.jctaxes.lots;

import com.jctaxes.datasource.ParcelFragment;
import com.jctaxes.geometry.NormalizedGeometry;

/** A parcel fragment whose geometry has been decoded and reprojected. */
public class NormalizedFragment {

    public final ParcelFragment fragment;

    public final NormalizedGeometry geometry;

    public NormalizedFragment (ParcelFragment fragment, NormalizedGeometry geometry) {
        this.fragment = fragment;
        this.geometry = geometry;
    }

}
