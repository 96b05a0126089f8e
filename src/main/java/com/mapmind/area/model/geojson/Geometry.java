package com.mapmind.area.model.geojson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * GeoJSON geometry. coordinates 는 타입마다 중첩 깊이가 달라서 Object 로 둔다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Geometry(String type, Object coordinates) {

    public static final String POINT = "Point";
    public static final String POLYGON = "Polygon";

    public static Geometry point(double lon, double lat) {
        return new Geometry(POINT, List.of(lon, lat));
    }

    public static Geometry polygon(List<List<Double>> ring) {
        return new Geometry(POLYGON, List.of(ring));
    }
}
