package com.jctaxes.output;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;

/** Reads GeoJSON geometry objects into JTS geometries. A JSON null yields a null geometry. */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    @Override
    public Geometry deserialize (JsonParser jsonParser, DeserializationContext deserializationContext)
            throws IOException {
        JsonNode node = jsonParser.readValueAsTree();
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return new GeoJsonReader(geometryFactory).read(node.toString());
        } catch (ParseException e) {
            throw new JsonParseException(jsonParser, "Invalid GeoJSON geometry: " + e.getMessage(), e);
        }
    }

}
