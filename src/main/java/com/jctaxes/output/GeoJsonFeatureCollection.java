package com.jctaxes.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** A GeoJSON FeatureCollection, for both reading registries and writing results. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoJsonFeatureCollection {
    public String type = "FeatureCollection";
    public List<GeoJsonFeature> features = new ArrayList<>();
}
