package com.mapmind.area.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.geojson.FeatureCollection;

import java.util.List;

/**
 * POST /analyze-area 응답.
 * geojson 은 POI 포인트만 담는다 (경계 폴리곤은 bbox 로 프론트가 그림).
 */
public record AreaAnalysisResponse(
        String summary,
        @JsonProperty("pie_chart_data") List<ChartEntry> pieChartData,
        @JsonProperty("ai_rating") int aiRating,
        GeocodeResponse geocode,
        BoundingBox bbox,
        FeatureCollection geojson,
        CategorizedPois pois
) {}
