package com.jctaxes.output;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.locationtech.jts.geom.Geometry;

/**
 * Shared Jackson configuration. Both mappers know how to read and write JTS geometries as GeoJSON.
 */
public abstract class JsonUtilities {

    /**
     * Fails on unrecognized fields. Used for our own configuration files, where an unknown field is almost always a
     * misspelling that would otherwise be silently ignored.
     */
    public static final ObjectMapper objectMapper = createBaseObjectMapper();

    /**
     * Ignores unrecognized fields. Used for third party GeoJSON, which may carry foreign members (bbox, crs, id...)
     * that we have no use for.
     */
    public static final ObjectMapper lenientObjectMapper = createBaseObjectMapper();

    static {
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        lenientObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static ObjectMapper createBaseObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(makeGeometryModule());
        objectMapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        return objectMapper;
    }

    public static SimpleModule makeGeometryModule () {
        SimpleModule module = new SimpleModule("JtsGeometry", new Version(1, 0, 0, null, null, null));
        module.addSerializer(Geometry.class, new GeometrySerializer());
        module.addDeserializer(Geometry.class, new GeometryDeserializer());
        return module;
    }

}
