package com.mapmind.area.service;

import com.mapmind.area.model.Coordinate;

import java.util.List;
import java.util.Locale;

/**
 * 반경 검색용 Overpass QL 생성기.
 * 8개 태그 계열을 nwr 로 union 하고, way/relation 은 center 를 받는다.
 */
public final class OverpassQuery {
    private OverpassQuery() {}

    static final List<String> TAG_FILTERS = List.of(
            "[\"amenity\"]",
            "[\"leisure\"]",
            "[\"shop\"]",
            "[\"office\"]",
            "[\"public_transport\"]",
            "[\"railway\"~\"^(station|halt|tram_stop)$\"]",
            "[\"healthcare\"]",
            "[\"education\"]"
    );

    public static String around(Coordinate center, int radiusMeters, int timeoutSeconds) {
        // Locale.ROOT: 소수점이 콤마로 찍히면 QL 문법 오류
        String around = String.format(Locale.ROOT, "(around:%d,%.7f,%.7f)",
                radiusMeters, center.lat(), center.lon());

        StringBuilder ql = new StringBuilder();
        ql.append("[out:json][timeout:").append(timeoutSeconds).append("];\n");
        ql.append("(\n");
        for (String filter : TAG_FILTERS) {
            ql.append("  nwr").append(filter).append(around).append(";\n");
        }
        ql.append(");\n");
        ql.append("out center;\n");
        return ql.toString();
    }
}
