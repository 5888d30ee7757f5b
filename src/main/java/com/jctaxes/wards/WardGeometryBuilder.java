package com.jctaxes.wards;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.jctaxes.census.OverlayFragment;
import com.jctaxes.geometry.CoordinateTransforms;
import com.jctaxes.geometry.GeometrySettings;
import com.jctaxes.geometry.Polygons;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds the alternate shapes drawn for a ward. The official ward boundary includes streets, rail yards and water,
 * which makes a choropleth of tax per area look misleadingly uniform. These shapes are made from the land that
 * actually carries the ward's lots instead. All of the work happens in planar coordinates, where distances and areas
 * are in feet, and the results are returned in planar coordinates; use {@link #toWgs84} before output.
 */
public class WardGeometryBuilder {

    private final GeometrySettings settings;

    private final CoordinateTransforms transforms;

    public WardGeometryBuilder (GeometrySettings settings, CoordinateTransforms transforms) {
        this.settings = settings;
        this.transforms = transforms;
    }

    /**
     * The union of the tax-paying fragments, simplified. Parks and other land paying nothing show up as gaps.
     */
    public Geometry trimmedFootprint (Collection<OverlayFragment> fragments) {
        List<Geometry> geometries = new ArrayList<>();
        for (OverlayFragment fragment : fragments) {
            if (fragment.isTaxPaying()) {
                geometries.add(fragment.geometry);
            }
        }
        return Polygons.simplify(Polygons.dissolve(geometries), settings.simplifyToleranceFt);
    }

    /**
     * The union of all fragments with the streets between them closed up: a buffer outwards by roughly a street
     * width followed by an erosion by the same distance fuses lots facing each other across a street, while leaving
     * the outer edge where it was. Holes too small to be anything but street artifacts are then filled. The hole
     * threshold is inclusive, a hole of exactly the minimum area is kept.
     */
    public Geometry mergedBoundary (Collection<OverlayFragment> fragments) {
        List<Geometry> geometries = new ArrayList<>(fragments.size());
        for (OverlayFragment fragment : fragments) {
            geometries.add(fragment.geometry);
        }
        Geometry merged = Polygons.dissolve(geometries);
        if (settings.mergeBufferFt > 0) {
            merged = merged.buffer(settings.mergeBufferFt).buffer(-settings.mergeBufferFt);
        }
        merged = Polygons.simplify(merged, settings.simplifyToleranceFt);
        return Polygons.removeSmallHoles(merged, settings.minHoleAreaSqft);
    }

    /**
     * One shape per city block in the ward, each the union of the fragments of that block, collected without any
     * further union so that block edges remain visible.
     */
    public Geometry blockOutline (Collection<OverlayFragment> fragments) {
        ListMultimap<String, Geometry> geometriesByBlock = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (OverlayFragment fragment : fragments) {
            geometriesByBlock.put(String.valueOf(fragment.cityBlock), fragment.geometry);
        }
        List<Geometry> blocks = new ArrayList<>(geometriesByBlock.keySet().size());
        for (String cityBlock : geometriesByBlock.keySet()) {
            blocks.add(Polygons.dissolve(geometriesByBlock.get(cityBlock)));
        }
        return Polygons.toMultiPolygon(blocks);
    }

    public Geometry toWgs84 (Geometry planarGeometry) {
        return transforms.toWgs84(planarGeometry);
    }

}
