package com.jctaxes.output;

import com.jctaxes.aggregation.AggregateResult;
import com.jctaxes.aggregation.AggregationLevel;
import com.jctaxes.datasource.DataSourceException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Writes aggregation results as a GeoJSON FeatureCollection, one feature per result. Identifying attributes come
 * first, then the year and totals, then any alternate geometries. Values are rounded for display and absent values
 * are left out rather than written as null.
 */
public abstract class FeatureWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureWriter.class);

    public static GeoJsonFeatureCollection toFeatureCollection (List<AggregateResult> results, int year) {
        GeoJsonFeatureCollection collection = new GeoJsonFeatureCollection();
        for (AggregateResult result : results) {
            collection.features.add(toFeature(result, year));
        }
        return collection;
    }

    public static GeoJsonFeature toFeature (AggregateResult result, int year) {
        GeoJsonFeature feature = new GeoJsonFeature(result.geometry);
        for (Map.Entry<String, Object> attribute : result.attributes.entrySet()) {
            feature.addOptionalProperty(attribute.getKey(), attribute.getValue());
        }
        feature.addProperty("year", year);
        feature.addProperty("paid", Rounding.currency(result.paid));
        feature.addProperty("billed", Rounding.currency(result.billed));
        feature.addProperty("area_sqft", Rounding.area(result.areaSqft));
        feature.addProperty("paid_per_sqft", Rounding.rate(result.paidPerSqft()));
        feature.addOptionalProperty("population", result.population);
        OptionalDouble perCapita = result.paidPerCapita();
        if (perCapita.isPresent()) {
            feature.addProperty("paid_per_capita", Rounding.rate(perCapita.getAsDouble()));
        }
        for (Map.Entry<String, Geometry> auxiliary : result.auxiliaryGeometries.entrySet()) {
            feature.addProperty(auxiliary.getKey(), auxiliary.getValue());
        }
        return feature;
    }

    /**
     * Write the results for one year and level into the output directory, creating it if needed.
     * @return the file written.
     */
    public static File write (List<AggregateResult> results, int year, AggregationLevel level, File outputDir) {
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            throw new DataSourceException("Could not create output directory " + outputDir);
        }
        File file = new File(outputDir, level.fileName(year));
        GeoJsonFeatureCollection collection = toFeatureCollection(results, year);
        try (OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(file))) {
            JsonUtilities.objectMapper.writeValue(outputStream, collection);
        } catch (IOException e) {
            throw new DataSourceException("Could not write " + file, e);
        }
        LOG.info("Wrote {} features to {}.", collection.features.size(), file);
        return file;
    }

    /** Read back a file written by {@link #write}. Geometry-valued properties are returned as plain JSON maps. */
    public static GeoJsonFeatureCollection read (File file) {
        try {
            return JsonUtilities.lenientObjectMapper.readValue(file, GeoJsonFeatureCollection.class);
        } catch (IOException e) {
            throw new DataSourceException("Could not read feature collection " + file, e);
        }
    }

}
