package com.mapmind.area.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * OSM element 종류. way/relation 은 center 좌표를 쓰므로 한 종류로 묶는다.
 */
public enum PoiKind {
    NODE("node"),
    WAY_OR_RELATION("way_or_relation");

    private final String value;

    PoiKind(String value) {
        this.value = value;
    }

    public static PoiKind fromOsmType(String osmType) {
        return "node".equals(osmType) ? NODE : WAY_OR_RELATION;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
