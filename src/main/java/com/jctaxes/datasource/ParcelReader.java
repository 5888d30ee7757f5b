package com.jctaxes.datasource;

import com.csvreader.CsvReader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.jctaxes.output.JsonUtilities;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the parcel source, either a CSV export with the geometry in a text column (hex well-known binary or GeoJSON)
 * or a GeoJSON FeatureCollection. The encoding of each geometry is identified here; decoding happens later.
 */
public abstract class ParcelReader {

    private static final Logger LOG = LoggerFactory.getLogger(ParcelReader.class);

    public static final String GEOMETRY_COLUMN = "geo_shape";

    public static List<ParcelFragment> read (File file) {
        String name = file.getName().toLowerCase();
        List<ParcelFragment> fragments;
        try {
            if (name.endsWith(".geojson") || name.endsWith(".json")) {
                fragments = readGeoJson(file);
            } else {
                fragments = readCsv(file);
            }
        } catch (IOException e) {
            throw new DataSourceException("Could not read parcels from " + file, e);
        }
        LOG.info("Read {} parcel fragments from {}.", fragments.size(), file);
        return fragments;
    }

    private static List<ParcelFragment> readCsv (File file) throws IOException {
        List<ParcelFragment> fragments = new ArrayList<>();
        try (InputStream inputStream = new FileInputStream(file)) {
            CsvReader reader = new CsvReader(inputStream, ',', StandardCharsets.UTF_8);
            // Polygons of large lots easily exceed the default limit on column length.
            reader.setSafetySwitch(false);
            CsvColumns columns = new CsvColumns(reader, file);
            int blockCol = columns.required("block");
            int lotCol = columns.required("lot");
            int qualCol = columns.optional("qual");
            int geometryCol = columns.required(GEOMETRY_COLUMN);
            while (reader.readRecord()) {
                fragments.add(ParcelFragment.fromSourceValue(
                    columns.get(blockCol),
                    columns.get(lotCol),
                    columns.get(qualCol),
                    columns.get(geometryCol)
                ));
            }
        }
        return fragments;
    }

    private static List<ParcelFragment> readGeoJson (File file) throws IOException {
        JsonNode root = JsonUtilities.lenientObjectMapper.readTree(file);
        JsonNode features = root.get("features");
        if (features == null || !features.isArray()) {
            throw new DataSourceException("Parcel file " + file + " is not a GeoJSON FeatureCollection.");
        }
        List<ParcelFragment> fragments = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            JsonNode properties = feature.path("properties");
            fragments.add(ParcelFragment.fromSourceValue(
                GeoJsonProperties.text(properties, "block"),
                GeoJsonProperties.text(properties, "lot"),
                GeoJsonProperties.text(properties, "qual"),
                parseGeometry(feature.get("geometry"))
            ));
        }
        return fragments;
    }

    /**
     * Parse the geometry of one feature. A geometry that does not parse is handed on as GeoJSON text, which will fail
     * again on decoding and mark only this fragment's lot as unparseable, not the whole file.
     */
    private static Object parseGeometry (JsonNode geometryNode) {
        if (geometryNode == null || geometryNode.isNull()) {
            return null;
        }
        try {
            return JsonUtilities.lenientObjectMapper.treeToValue(geometryNode, Geometry.class);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.debug("Could not parse parcel geometry: {}", e.getMessage());
            return geometryNode.toString();
        }
    }

}
