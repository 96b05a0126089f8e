package com.mapmind.area.model;

/**
 * WGS84 좌표. 범위를 벗어난 값은 생성 시점에 거부한다.
 */
public record Coordinate(double lat, double lon) {

    public Coordinate {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("lat out of range: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("lon out of range: " + lon);
        }
    }
}
