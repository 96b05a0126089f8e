package com.mapmind.area.model.geojson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Feature(String type, Geometry geometry, Map<String, Object> properties) {

    public static final String TYPE = "Feature";

    // properties.type 값
    public static final String KIND_BOUNDARY = "boundary";
    public static final String KIND_POI = "poi";

    public static Feature of(Geometry geometry, Map<String, Object> properties) {
        return new Feature(TYPE, geometry, properties);
    }

    @JsonIgnore
    public String kind() {
        if (properties == null) return null;
        Object kind = properties.get("type");
        return (kind != null) ? kind.toString() : null;
    }

    @JsonIgnore
    public boolean isBoundary() {
        return KIND_BOUNDARY.equals(kind());
    }

    @JsonIgnore
    public boolean isPoi() {
        return KIND_POI.equals(kind());
    }
}
