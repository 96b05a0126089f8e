package com.mapmind.area.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;

/**
 * 태그에서 raw category 를 한 번 뽑아 둔 POI.
 * category 가 비어 있는 POI 는 애초에 만들어지지 않는다 (추출 단계에서 버림).
 */
@JsonPropertyOrder({"lat", "lon", "tags", "type"})
public record RawPoi(
        @JsonIgnore Coordinate coordinate,
        @JsonIgnore String category,
        Map<String, String> tags,
        @JsonProperty("type") PoiKind kind
) {

    public RawPoi {
        Objects.requireNonNull(coordinate, "coordinate");
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("raw category must not be blank");
        }
        tags = (tags == null) ? Map.of() : Map.copyOf(tags);
    }

    @JsonProperty("lat")
    public double lat() {
        return coordinate.lat();
    }

    @JsonProperty("lon")
    public double lon() {
        return coordinate.lon();
    }

    /** name 태그가 없으면 fallback 라벨 사용 */
    public String nameOr(String fallback) {
        String name = tags.get("name");
        return (name != null && !name.isBlank()) ? name : fallback;
    }
}
