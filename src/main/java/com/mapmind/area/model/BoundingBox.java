package com.mapmind.area.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * [west, south, east, north] 순서의 사각 영역.
 * JSON 으로는 4개짜리 배열로 나간다 (프론트 bbox 포맷 그대로).
 */
public record BoundingBox(double west, double south, double east, double north) {

    public BoundingBox {
        if (!(west < east)) {
            throw new IllegalArgumentException("west must be < east: " + west + " / " + east);
        }
        if (!(south < north)) {
            throw new IllegalArgumentException("south must be < north: " + south + " / " + north);
        }
    }

    /**
     * 좌표를 중심으로 한 정사각형 (halfWidthDeg 만큼 상하좌우 확장).
     */
    public static BoundingBox around(Coordinate center, double halfWidthDeg) {
        return new BoundingBox(
                center.lon() - halfWidthDeg,
                center.lat() - halfWidthDeg,
                center.lon() + halfWidthDeg,
                center.lat() + halfWidthDeg
        );
    }

    /** 경계 폴리곤 링: SW → NW → NE → SE → SW (GeoJSON [lon, lat]) */
    public List<List<Double>> ring() {
        return List.of(
                List.of(west, south),
                List.of(west, north),
                List.of(east, north),
                List.of(east, south),
                List.of(west, south)
        );
    }

    @JsonValue
    public List<Double> toList() {
        return List.of(west, south, east, north);
    }
}
