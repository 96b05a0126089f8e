package com.mapmind.area.service.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.config.AnalysisProperties;
import com.mapmind.area.exception.AreaAnalysisException;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.service.enrichment.AreaPrompts;
import com.mapmind.area.service.enrichment.GenerativeTextClient;
import com.mapmind.area.util.LlmJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 경계 + POI GeoJSON 생성.
 *
 * geometry-enrichment-enabled 이고 모델이 있으면 생성형 모델에 먼저 맡기고,
 * 응답이 없거나/깨졌거나/모양이 다르면 결정적 빌더 결과로 대체한다.
 * 어느 경로든 호출자에게 예외가 나가지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeometrySynthesizer {

    public static final String STAGE = "geometry-enrichment";

    private final DeterministicGeometryBuilder builder;
    private final EnrichedGeometryValidator validator;
    private final GenerativeTextClient client;
    private final AreaPrompts prompts;
    private final AnalysisProperties props;
    private final ObjectMapper objectMapper;

    public FeatureCollection synthesize(String area, String city, CategorizedPois pois,
                                        BoundingBox bbox, ColorMode colorMode) {
        if (props.isGeometryEnrichmentEnabled() && client.isAvailable()) {
            try {
                FeatureCollection enriched = enrich(area, city, pois, bbox);
                log.info("Using generated geometry for '{}, {}' ({} features)",
                        area, city, enriched.features().size());
                return enriched;
            } catch (AreaAnalysisException e) {
                log.warn("Geometry enrichment rejected for '{}, {}', falling back: {}", area, city, e.getMessage());
            }
        }
        return builder.build(area, city, pois, bbox, colorMode);
    }

    /** 분석 응답용 POI 전용 문서. 보강 없이 항상 결정적 경로 */
    public FeatureCollection poisOnly(CategorizedPois pois) {
        return builder.poisOnly(pois);
    }

    private FeatureCollection enrich(String area, String city, CategorizedPois pois, BoundingBox bbox) {
        String text = client.generate(STAGE, prompts.geometry(area, city, pois, bbox), props.getGeometryTimeout());
        JsonNode json = LlmJson.extractObject(text, objectMapper, STAGE);
        return validator.validate(json, pois, STAGE);
    }
}
