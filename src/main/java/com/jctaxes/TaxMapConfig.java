package com.jctaxes;

import com.jctaxes.geometry.GeometrySettings;

import java.io.File;
import java.util.Map;
import java.util.Properties;

/**
 * Locations of the input and output files, and the geometry thresholds. Input files are required; thresholds fall
 * back on the values tuned for Jersey City when not configured.
 */
public class TaxMapConfig extends ConfigBase {

    public final File paymentsFile;

    public final File parcelsFile;

    public final File censusBlocksFile;

    public final File wardsFile;

    /** Optional table of addresses, owners and street names per key. Null if not configured. */
    public final File enrichmentFile;

    /** Optional replacement for the bundled omnibus table. Null if not configured. */
    public final File omnibusFile;

    public final File outputDir;

    public final GeometrySettings geometrySettings;

    public TaxMapConfig (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    TaxMapConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        paymentsFile = fileProp("payments-file");
        parcelsFile = fileProp("parcels-file");
        censusBlocksFile = fileProp("census-blocks-file");
        wardsFile = fileProp("wards-file");
        enrichmentFile = optionalFileProp("enrichment-file");
        omnibusFile = optionalFileProp("omnibus-file");
        outputDir = fileProp("output-dir");
        GeometrySettings settings = null;
        String planarCrs = optionalStrProp("planar-crs");
        double projectedMinX = doubleProp("projected-min-x", GeometrySettings.DEFAULT_PROJECTED_MIN_X);
        double simplifyTolerance = doubleProp("simplify-tolerance-ft", GeometrySettings.DEFAULT_SIMPLIFY_TOLERANCE_FT);
        double mergeBuffer = doubleProp("merge-buffer-ft", GeometrySettings.DEFAULT_MERGE_BUFFER_FT);
        double minHoleArea = doubleProp("min-hole-area-sqft", GeometrySettings.DEFAULT_MIN_HOLE_AREA_SQFT);
        try {
            settings = new GeometrySettings(
                planarCrs == null ? GeometrySettings.DEFAULT_PLANAR_CRS : planarCrs,
                projectedMinX,
                simplifyTolerance,
                mergeBuffer,
                minHoleArea
            );
        } catch (IllegalArgumentException e) {
            keysWithErrors.add("geometry thresholds (" + e.getMessage() + ")");
        }
        geometrySettings = settings;
        throwIfErrors();
    }

    public static TaxMapConfig fromFile (String filename) {
        return new TaxMapConfig(propsFromFile(filename));
    }

    private File fileProp (String key) {
        String value = strProp(key);
        return value == null ? null : new File(value.trim());
    }

    private File optionalFileProp (String key) {
        String value = optionalStrProp(key);
        return value == null ? null : new File(value);
    }

}
