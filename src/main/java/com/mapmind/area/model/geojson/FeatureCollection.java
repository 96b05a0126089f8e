package com.mapmind.area.model.geojson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureCollection(String type, List<Feature> features) {

    public static final String TYPE = "FeatureCollection";

    public static FeatureCollection of(List<Feature> features) {
        return new FeatureCollection(TYPE, List.copyOf(features));
    }

    public long boundaryCount() {
        return features.stream().filter(Feature::isBoundary).count();
    }

    public long poiCount() {
        return features.stream().filter(Feature::isPoi).count();
    }
}
