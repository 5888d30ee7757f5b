package com.jctaxes.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.jctaxes.census.CensusBlock;
import com.jctaxes.census.CensusRegistry;
import com.jctaxes.census.Ward;
import com.jctaxes.geometry.GeometryNormalizer;
import com.jctaxes.geometry.NormalizedGeometry;
import com.jctaxes.geometry.RawGeometry;
import com.jctaxes.output.JsonUtilities;
import com.jctaxes.util.SkipCounts;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the census block and ward registries, both GeoJSON FeatureCollections prepared by an upstream step that has
 * already assigned each census block to a ward. Geometries go through the same normalization as parcels, so either
 * file may be in WGS84 or in state plane feet.
 */
public class CensusRegistryReader {

    private static final Logger LOG = LoggerFactory.getLogger(CensusRegistryReader.class);

    public static final String BAD_GEOMETRY = "missing or unparseable geometry";
    public static final String NO_GEOID = "missing GEOID";

    private final GeometryNormalizer normalizer;

    public CensusRegistryReader (GeometryNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public CensusRegistry read (File censusBlocksFile, File wardsFile) {
        List<CensusBlock> blocks = readBlocks(censusBlocksFile);
        List<Ward> wards = readWards(wardsFile);
        LOG.info("Loaded {} census blocks and {} wards.", blocks.size(), wards.size());
        return new CensusRegistry(blocks, wards);
    }

    public List<CensusBlock> readBlocks (File file) {
        SkipCounts skipCounts = new SkipCounts(LOG, "Reading census blocks");
        List<CensusBlock> blocks = new ArrayList<>();
        for (JsonNode feature : readFeatures(file)) {
            skipCounts.seen();
            JsonNode properties = feature.path("properties");
            String geoid = GeoJsonProperties.text(properties, "GEOID");
            if (geoid == null) {
                skipCounts.skipped(NO_GEOID);
                continue;
            }
            NormalizedGeometry geometry = normalize(feature, geoid);
            if (geometry == null) {
                skipCounts.skipped(BAD_GEOMETRY);
                continue;
            }
            blocks.add(new CensusBlock(
                geoid,
                parsePopulation(GeoJsonProperties.text(properties, "POP100")),
                GeoJsonProperties.text(properties, "ward"),
                geometry.wgsGeometry,
                geometry.planarGeometry
            ));
        }
        skipCounts.logSummary();
        return blocks;
    }

    public List<Ward> readWards (File file) {
        SkipCounts skipCounts = new SkipCounts(LOG, "Reading wards");
        List<Ward> wards = new ArrayList<>();
        for (JsonNode feature : readFeatures(file)) {
            skipCounts.seen();
            JsonNode properties = feature.path("properties");
            String id = GeoJsonProperties.text(properties, "ward");
            NormalizedGeometry geometry = normalize(feature, id);
            if (id == null || geometry == null) {
                skipCounts.skipped(BAD_GEOMETRY);
                continue;
            }
            String councilPerson = GeoJsonProperties.text(properties, "council_person");
            if (councilPerson == null) {
                // Shapefile exports truncate field names to ten characters.
                councilPerson = GeoJsonProperties.text(properties, "council_pe");
            }
            wards.add(new Ward(id, councilPerson, geometry.wgsGeometry));
        }
        skipCounts.logSummary();
        return wards;
    }

    /** The census reports population as text; anything that is not a whole number counts as nobody. */
    static int parsePopulation (String text) {
        if (text == null) {
            return 0;
        }
        try {
            return (int) Math.round(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private NormalizedGeometry normalize (JsonNode feature, String id) {
        JsonNode geometryNode = feature.get("geometry");
        if (geometryNode == null || geometryNode.isNull()) {
            LOG.debug("Feature {} has no geometry.", id);
            return null;
        }
        try {
            Geometry geometry = JsonUtilities.lenientObjectMapper.treeToValue(geometryNode, Geometry.class);
            return normalizer.normalize(RawGeometry.of(geometry));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Feature {} has an unusable geometry: {}", id, e.getMessage());
            return null;
        }
    }

    private static List<JsonNode> readFeatures (File file) {
        JsonNode root;
        try {
            root = JsonUtilities.lenientObjectMapper.readTree(file);
        } catch (IOException e) {
            throw new DataSourceException("Could not read GeoJSON from " + file, e);
        }
        JsonNode features = root.get("features");
        if (features == null || !features.isArray()) {
            throw new DataSourceException(file + " is not a GeoJSON FeatureCollection.");
        }
        List<JsonNode> result = new ArrayList<>(features.size());
        features.forEach(result::add);
        return result;
    }

}
