package com.mapmind.area.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapmind.area.config.OverpassProperties;
import com.mapmind.area.exception.PoiSourceException;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.Coordinate;
import com.mapmind.area.model.PoiKind;
import com.mapmind.area.model.RawPoi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Overpass 반경 검색 → raw category 별로 묶인 POI.
 *
 * - node 는 자기 좌표, way/relation 은 center 좌표 사용
 * - 좌표가 없거나 인식 가능한 태그가 없는 element 는 조용히 버린다
 * - 쿼리 자체가 실패하면 PoiSourceException (부분 결과 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoiExtractor {

    /**
     * raw category 도출 규칙. 위에서부터 첫 번째로 걸리는 태그 키가 이긴다.
     */
    record TagRule(String key, UnaryOperator<String> label) {}

    static final List<TagRule> TAG_RULES = List.of(
            new TagRule("amenity", v -> v),
            new TagRule("shop", v -> "shop_" + v),
            new TagRule("leisure", v -> "leisure_" + v),
            new TagRule("healthcare", v -> "healthcare_" + v),
            new TagRule("building", v -> "building_" + v),
            new TagRule("office", v -> "office_" + v),
            new TagRule("public_transport", v -> "public_transport"),
            new TagRule("railway", v -> "railway_" + v)
    );

    private final WebClient overpassWebClient;
    private final OverpassProperties props;
    private final ObjectMapper objectMapper;

    public Mono<CategorizedPois> extract(Coordinate center, int radiusMeters) {
        String ql = OverpassQuery.around(center, radiusMeters, props.getQueryTimeoutSeconds());
        log.debug("Overpass query:\n{}", ql);

        return overpassWebClient.post()
                .uri("/interpreter")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("data", ql))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(props.getTimeout())
                .onErrorMap(e -> new PoiSourceException("Error fetching POIs: " + e.getMessage(), e))
                .switchIfEmpty(Mono.error(() -> new PoiSourceException("Error fetching POIs: empty response", null)))
                .map(this::categorize);
    }

    CategorizedPois categorize(JsonNode root) {
        JsonNode elements = root.path("elements");
        if (!elements.isArray()) {
            throw new PoiSourceException("Overpass response has no elements array", null);
        }

        CategorizedPois pois = new CategorizedPois();
        int skipped = 0;
        for (JsonNode node : elements) {
            Optional<RawPoi> poi = toPoi(node);
            if (poi.isPresent()) {
                pois.add(poi.get());
            } else {
                skipped++;
            }
        }
        log.info("Overpass returned {} elements: kept {} POIs in {} categories, skipped {}",
                elements.size(), pois.totalCount(), pois.categoryCount(), skipped);
        return pois;
    }

    private Optional<RawPoi> toPoi(JsonNode node) {
        OverpassElement element;
        try {
            element = objectMapper.treeToValue(node, OverpassElement.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Skipping malformed element {}: {}", node.path("id").asText(), e.getMessage());
            return Optional.empty();
        }

        Optional<Coordinate> coordinate = element.coordinate();
        if (coordinate.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> tags = presentTags(element.tags());
        return deriveCategory(tags)
                .map(category -> new RawPoi(coordinate.get(), category, tags, PoiKind.fromOsmType(element.type())));
    }

    // "name": null 같은 값 없는 태그는 없는 태그로 본다
    static Map<String, String> presentTags(Map<String, String> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, String> tags = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                tags.put(k, v);
            }
        });
        return tags;
    }

    /**
     * 태그 → raw category. 값이 비어 있는 키는 없는 것으로 보고 다음 규칙으로 넘어간다.
     */
    static Optional<String> deriveCategory(Map<String, String> tags) {
        for (TagRule rule : TAG_RULES) {
            String value = tags.get(rule.key());
            if (value != null && !value.isBlank()) {
                return Optional.of(rule.label().apply(value));
            }
        }
        return Optional.empty();
    }

    // --- Overpass 응답 DTO ---
    @JsonIgnoreProperties(ignoreUnknown = true)
    record OverpassElement(String type, Long id, Double lat, Double lon, Center center, Map<String, String> tags) {

        Optional<Coordinate> coordinate() {
            Double la = "node".equals(type) ? lat : (center != null ? center.lat() : null);
            Double lo = "node".equals(type) ? lon : (center != null ? center.lon() : null);
            if (la == null || lo == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(new Coordinate(la, lo));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Center(Double lat, Double lon) {}
}
