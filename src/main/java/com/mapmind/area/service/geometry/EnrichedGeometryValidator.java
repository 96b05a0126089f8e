package com.mapmind.area.service.geometry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.exception.EnrichmentParseException;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.geojson.Feature;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.model.geojson.Geometry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 생성형 모델이 만든 GeoJSON 을 받아들일지 판정한다.
 *
 * 통과 조건:
 * - type == "FeatureCollection", features 배열 존재
 * - 모든 feature 에 geometry.type / geometry.coordinates 존재
 * - boundary 는 Polygon (닫힌 숫자 좌표 ring), poi 는 Point ([lon, lat] 숫자)
 * - boundary feature 정확히 1개
 * - poi feature 수 == 입력 POI 수
 */
@Component
@RequiredArgsConstructor
public class EnrichedGeometryValidator {

    private final ObjectMapper objectMapper;

    public FeatureCollection validate(JsonNode json, CategorizedPois expected, String stage) {
        if (!FeatureCollection.TYPE.equals(json.path("type").asText(null))) {
            throw new EnrichmentParseException(stage, "Generated document is not a FeatureCollection");
        }
        if (!json.path("features").isArray()) {
            throw new EnrichmentParseException(stage, "Generated document has no features array");
        }

        FeatureCollection doc;
        try {
            doc = objectMapper.treeToValue(json, FeatureCollection.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EnrichmentParseException(stage, "Generated features do not bind: " + e.getMessage(), e);
        }

        List<Feature> features = doc.features();
        for (Feature f : features) {
            if (f == null || f.geometry() == null || f.geometry().type() == null
                    || f.geometry().coordinates() == null) {
                throw new EnrichmentParseException(stage, "Generated feature without geometry");
            }
            if (f.isBoundary() && !isPolygon(f.geometry())) {
                throw new EnrichmentParseException(stage,
                        "Generated boundary is not a polygon: " + f.geometry().type());
            }
            if (f.isPoi() && !isPoint(f.geometry())) {
                throw new EnrichmentParseException(stage,
                        "Generated POI is not a point: " + f.geometry().type());
            }
        }
        if (doc.boundaryCount() != 1) {
            throw new EnrichmentParseException(stage,
                    "Expected exactly one boundary feature, got " + doc.boundaryCount());
        }
        if (doc.poiCount() != expected.totalCount()) {
            throw new EnrichmentParseException(stage,
                    "Expected " + expected.totalCount() + " POI features, got " + doc.poiCount());
        }
        return doc;
    }

    static boolean isPoint(Geometry geometry) {
        return Geometry.POINT.equals(geometry.type()) && isPosition(geometry.coordinates());
    }

    static boolean isPolygon(Geometry geometry) {
        if (!Geometry.POLYGON.equals(geometry.type()) || !(geometry.coordinates() instanceof List)) {
            return false;
        }
        List<?> rings = (List<?>) geometry.coordinates();
        if (rings.isEmpty()) {
            return false;
        }
        for (Object ring : rings) {
            if (!(ring instanceof List) || ((List<?>) ring).size() < 4) {
                return false;
            }
            for (Object position : (List<?>) ring) {
                if (!isPosition(position)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isPosition(Object value) {
        if (!(value instanceof List) || ((List<?>) value).size() < 2) {
            return false;
        }
        for (Object axis : (List<?>) value) {
            if (!(axis instanceof Number)) {
                return false;
            }
        }
        return true;
    }
}
