package com.mapmind.area.service;

import com.mapmind.area.config.AnalysisProperties;
import com.mapmind.area.dto.request.AreaAnalysisRequest;
import com.mapmind.area.dto.response.AreaAnalysisResponse;
import com.mapmind.area.dto.response.ChartEntry;
import com.mapmind.area.dto.response.GeocodeResponse;
import com.mapmind.area.model.AreaSummary;
import com.mapmind.area.model.CategorizedPois;
import com.mapmind.area.model.ResolvedArea;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.service.enrichment.AreaSummaryService;
import com.mapmind.area.service.geometry.ColorMode;
import com.mapmind.area.service.geometry.GeometrySynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * 분석 요청 오케스트레이션.
 * 지오코딩 → POI 추출 → (요약 생성 || 차트/GeoJSON 계산) → 응답 조립.
 *
 * 지오코딩/POI 실패는 요청 실패. 요약은 실패해도 빈 값으로 계속 간다 (AreaSummaryService 참고).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AreaAnalysisService {

    private final AreaResolver areaResolver;
    private final PoiExtractor poiExtractor;
    private final Aggregator aggregator;
    private final GeometrySynthesizer geometrySynthesizer;
    private final AreaSummaryService summaryService;
    private final AnalysisProperties props;

    public Mono<AreaAnalysisResponse> analyze(AreaAnalysisRequest request) {
        String area = request.area();
        String city = request.city();
        log.info("=== Starting Analysis for: {}, {} ===", area, city);

        return resolveAndExtract(area, city)
                .flatMap(ctx -> {
                    CategorizedPois pois = ctx.pois();
                    log.info("[3/3] Summarizing {} POIs", pois.totalCount());

                    // 요약 호출은 POI 에만 의존하므로 차트/GeoJSON 계산과 병렬로
                    Mono<AreaSummary> summary = Mono.fromCallable(() -> summaryService.summarize(area, city, pois))
                            .subscribeOn(Schedulers.boundedElastic());

                    List<ChartEntry> chart = aggregator.aggregate(pois);
                    FeatureCollection geojson = geometrySynthesizer.poisOnly(pois);

                    return summary.map(s -> new AreaAnalysisResponse(
                            s.summary(),
                            chart,
                            s.rating(),
                            GeocodeResponse.of(ctx.area()),
                            ctx.area().boundingBox(),
                            geojson,
                            pois
                    ));
                })
                .doOnSuccess(r -> log.info("=== Analysis done for: {}, {} (rating {}) ===", area, city, r.aiRating()));
    }

    /** 경계 폴리곤 포함 전체 GeoJSON */
    public Mono<FeatureCollection> geometry(AreaAnalysisRequest request, ColorMode colorMode) {
        String area = request.area();
        String city = request.city();
        return resolveAndExtract(area, city)
                .publishOn(Schedulers.boundedElastic())
                .map(ctx -> geometrySynthesizer.synthesize(area, city, ctx.pois(), ctx.area().boundingBox(), colorMode));
    }

    public Mono<ResolvedArea> resolve(String area, String city) {
        return areaResolver.resolve(area, city);
    }

    private Mono<AnalysisContext> resolveAndExtract(String area, String city) {
        log.info("[1/3] Geocoding {}, {}", area, city);
        return areaResolver.resolve(area, city)
                .flatMap(resolved -> {
                    log.info("[2/3] Getting POIs from Overpass around ({}, {})",
                            resolved.coordinate().lat(), resolved.coordinate().lon());
                    return poiExtractor.extract(resolved.coordinate(), props.getRadiusMeters())
                            .map(pois -> new AnalysisContext(resolved, pois));
                });
    }

    private record AnalysisContext(ResolvedArea area, CategorizedPois pois) {}
}
