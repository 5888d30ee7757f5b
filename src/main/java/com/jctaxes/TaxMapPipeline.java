package com.jctaxes;

import com.jctaxes.aggregation.AggregateResult;
import com.jctaxes.aggregation.AggregationLevel;
import com.jctaxes.aggregation.AggregationStrategy;
import com.jctaxes.datasource.TaxDataset;
import com.jctaxes.datasource.TaxDatasetLoader;
import com.jctaxes.geometry.CoordinateTransforms;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.geometry.GeometrySettings;
import com.jctaxes.lots.NormalizedParcels;
import com.jctaxes.output.FeatureWriter;
import com.jctaxes.wards.WardGeometryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;

/**
 * Wires the stages together for one run: load the inputs, normalize parcel geometry, aggregate to the requested
 * level and write the result file. The coordinate transforms are created once here and shared by every stage.
 */
public class TaxMapPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TaxMapPipeline.class);

    private final TaxMapConfig config;

    private final GeometryNormalizer normalizer;

    private final WardGeometryBuilder wardGeometryBuilder;

    public TaxMapPipeline (TaxMapConfig config) {
        this.config = config;
        GeometrySettings settings = config.geometrySettings;
        LOG.info("Geometry settings: {}", settings);
        CoordinateTransforms transforms = CoordinateTransforms.forSettings(settings);
        this.normalizer = new GeometryNormalizer(transforms, settings);
        this.wardGeometryBuilder = new WardGeometryBuilder(settings, transforms);
    }

    /** Compute the results for one year and level without writing them. */
    public List<AggregateResult> aggregate (int year, AggregationLevel level) {
        AggregationStrategy strategy = AggregationStrategy.forLevel(level);
        TaxDataset dataset = new TaxDatasetLoader(config, normalizer).load(strategy.needsCensus());
        NormalizedParcels parcels = NormalizedParcels.normalize(dataset.parcels, normalizer);
        return strategy.aggregate(parcels, dataset, year, wardGeometryBuilder);
    }

    /** @return the GeoJSON file written. */
    public File run (int year, AggregationLevel level) {
        long startTime = System.currentTimeMillis();
        List<AggregateResult> results = aggregate(year, level);
        File file = FeatureWriter.write(results, year, level, config.outputDir);
        LOG.info("Finished {} {} in {} sec.", year, level, (System.currentTimeMillis() - startTime) / 1000);
        return file;
    }

}
