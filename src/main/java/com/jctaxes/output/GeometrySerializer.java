package com.jctaxes.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.io.IOException;

/**
 * Writes JTS geometries as GeoJSON geometry objects. Coordinates are written with seven decimal places, about a
 * centimeter in WGS84, which keeps output files small without visible loss.
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    public static final int DECIMAL_PLACES = 7;

    @Override
    public void serialize (Geometry geometry, JsonGenerator jsonGenerator, SerializerProvider serializerProvider)
            throws IOException {
        GeoJsonWriter writer = new GeoJsonWriter(DECIMAL_PLACES);
        // GeoJSON (RFC 7946) has no CRS member, coordinates are always WGS84.
        writer.setEncodeCRS(false);
        jsonGenerator.writeRawValue(writer.write(geometry));
    }

}
