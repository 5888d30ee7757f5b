package com.jctaxes.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A GeoJSON Feature holding a JTS geometry. Property order is preserved on output so that files are readable and
 * diff cleanly between runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "geometry", "properties"})
public class GeoJsonFeature {

    private final Geometry geometry;

    private final Map<String, Object> properties;

    public GeoJsonFeature (Geometry geometry) {
        this(geometry, new LinkedHashMap<>());
    }

    @JsonCreator
    public GeoJsonFeature (
        @JsonProperty("geometry") Geometry geometry,
        @JsonProperty("properties") Map<String, Object> properties
    ) {
        this.geometry = geometry;
        this.properties = properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties);
    }

    @JsonProperty("type")
    public String getType () {
        return "Feature";
    }

    public Geometry getGeometry () {
        return geometry;
    }

    public Map<String, Object> getProperties () {
        return properties;
    }

    public void addProperty (String propertyName, Object propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    /** Add the property only if the value is present. GeoJSON consumers treat a missing key as absent. */
    public void addOptionalProperty (String propertyName, Object propertyValue) {
        if (propertyValue != null) {
            properties.put(propertyName, propertyValue);
        }
    }

}
