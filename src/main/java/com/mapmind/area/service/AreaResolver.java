package com.mapmind.area.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mapmind.area.config.AnalysisProperties;
import com.mapmind.area.config.GeocoderProperties;
import com.mapmind.area.exception.GeocodeException;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.Coordinate;
import com.mapmind.area.model.ResolvedArea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * "area, city" 문자열을 Nominatim 으로 좌표 + bbox 로 변환한다.
 * 지오코더가 extent 를 안 주면 고정 반폭 정사각형으로 채워서, 호출자는 bbox 누락을 볼 일이 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AreaResolver {

    private static final ParameterizedTypeReference<List<NominatimPlace>> PLACES =
            new ParameterizedTypeReference<>() {};

    private final WebClient geocoderWebClient;
    private final GeocoderProperties geocoderProps;
    private final AnalysisProperties analysisProps;

    public Mono<ResolvedArea> resolve(String area, String city) {
        String query = area + ", " + city;
        return geocoderWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/search")
                        .queryParam("q", query)
                        .queryParam("format", "json")
                        .queryParam("limit", 1)
                        .build())
                .retrieve()
                .bodyToMono(PLACES)
                .timeout(geocoderProps.getTimeout())
                .onErrorMap(e -> !(e instanceof GeocodeException),
                        e -> new GeocodeException("Geocoding failed: " + e.getMessage(), e))
                .map(places -> toResolvedArea(query, places));
    }

    private ResolvedArea toResolvedArea(String query, List<NominatimPlace> places) {
        if (places == null || places.isEmpty()) {
            throw new GeocodeException("Could not geocode area/city: " + query);
        }
        NominatimPlace best = places.get(0);

        Coordinate coordinate;
        try {
            coordinate = new Coordinate(Double.parseDouble(best.lat()), Double.parseDouble(best.lon()));
        } catch (NullPointerException | IllegalArgumentException e) {
            // NumberFormatException 도 IllegalArgumentException
            throw new GeocodeException("Geocoder returned an unusable coordinate for " + query, e);
        }

        BoundingBox bbox = toBoundingBox(best.boundingbox(), coordinate, analysisProps.getFallbackHalfWidthDeg());
        String displayName = (best.displayName() != null) ? best.displayName() : "";
        log.info("Geocoded '{}' -> ({}, {}) bbox={}", query, coordinate.lat(), coordinate.lon(), bbox.toList());
        return new ResolvedArea(coordinate, bbox, displayName);
    }

    /**
     * Nominatim boundingbox 는 [south, north, west, east] 문자열 배열.
     * 없거나 깨져 있으면 중심 좌표 기준 정사각형으로 대체.
     */
    static BoundingBox toBoundingBox(List<String> raw, Coordinate center, double halfWidthDeg) {
        if (raw != null && raw.size() == 4) {
            try {
                double south = Double.parseDouble(raw.get(0));
                double north = Double.parseDouble(raw.get(1));
                double west = Double.parseDouble(raw.get(2));
                double east = Double.parseDouble(raw.get(3));
                return new BoundingBox(west, south, east, north);
            } catch (NullPointerException | IllegalArgumentException e) {
                log.warn("Ignoring malformed geocoder extent {}: {}", raw, e.getMessage());
            }
        }
        return BoundingBox.around(center, halfWidthDeg);
    }

    // --- Nominatim 응답 DTO ---
    @JsonIgnoreProperties(ignoreUnknown = true)
    record NominatimPlace(
            String lat,                 // 문자열로 내려옴
            String lon,
            @JsonProperty("display_name") String displayName,
            List<String> boundingbox
    ) {}
}
