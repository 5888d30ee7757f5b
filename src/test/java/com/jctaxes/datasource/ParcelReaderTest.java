package com.jctaxes.datasource;

import com.jctaxes.TestData;
import com.jctaxes.TestGeometries;
import com.jctaxes.geometry.RawGeometry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParcelReaderTest {

    @Test
    void readGeoJsonFeatures () {
        List<ParcelFragment> fragments = ParcelReader.read(TestData.fixture("parcels.geojson"));
        assertEquals(7, fragments.size());
        ParcelFragment first = fragments.get(0);
        assertEquals("100", first.block);
        assertEquals("5", first.lot);
        assertEquals("C0001", first.qualifier);
        assertEquals(RawGeometry.Encoding.PARSED, first.rawGeometry.encoding());
        // Numeric identifiers are read as text.
        assertEquals("6", fragments.get(2).lot);
        assertNull(fragments.get(2).qualifier);
        ParcelFragment noGeometry = fragments.get(6);
        assertNull(noGeometry.rawGeometry);
        assertNull(noGeometry.geometryError);
    }

    @Test
    void readCsvWithMixedEncodings (@TempDir File tempDir) throws IOException {
        Polygon square = TestGeometries.rectangle(0, 0, 10, 10);
        String hex = WKBWriter.toHex(new WKBWriter().write(square));
        String json = new GeoJsonWriter().write(square).replace("\"", "\"\"");
        List<String> lines = Arrays.asList(
            "block,lot,qual,geo_shape",
            "100,5,C0001," + hex,
            "100,5,C0002,\"" + json + "\"",
            "100,6,,",
            "100,7,,POLYGON EMPTY"
        );
        File csv = new File(tempDir, "parcels.csv");
        Files.write(csv.toPath(), lines, StandardCharsets.UTF_8);

        List<ParcelFragment> fragments = ParcelReader.read(csv);
        assertEquals(4, fragments.size());
        assertEquals(RawGeometry.Encoding.WELL_KNOWN_BINARY, fragments.get(0).rawGeometry.encoding());
        assertEquals(RawGeometry.Encoding.GEOJSON_TEXT, fragments.get(1).rawGeometry.encoding());
        assertNull(fragments.get(2).rawGeometry);
        assertNull(fragments.get(2).geometryError);
        assertNull(fragments.get(3).rawGeometry);
        assertNotNull(fragments.get(3).geometryError);
    }

    @Test
    void csvWithoutGeometryColumnIsRejected (@TempDir File tempDir) throws IOException {
        File csv = new File(tempDir, "parcels.csv");
        Files.write(csv.toPath(), Arrays.asList("block,lot", "1,2"), StandardCharsets.UTF_8);
        assertThrows(DataSourceException.class, () -> ParcelReader.read(csv));
    }

}
