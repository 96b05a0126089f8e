package com.mapmind.area.controller;

import com.mapmind.area.dto.request.AreaAnalysisRequest;
import com.mapmind.area.dto.response.AreaAnalysisResponse;
import com.mapmind.area.model.geojson.FeatureCollection;
import com.mapmind.area.service.AreaAnalysisService;
import com.mapmind.area.service.geometry.ColorMode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "동네 분석", description = "POI 수집/분류, 차트 데이터, GeoJSON, 요약 API")
@RestController
@RequiredArgsConstructor
public class AreaAnalysisController {

    private final AreaAnalysisService analysisService;

    /**
     * POST /analyze-area
     * 프론트가 쓰는 경로 그대로 유지.
     */
    @Operation(
            summary = "동네 분석",
            description = """
        area, city 를 지오코딩하고 반경 내 POI 를 모아 상위 카테고리 차트, POI GeoJSON,
        생성형 요약/15분 도시 점수를 함께 돌려줍니다. 요약 생성 실패 시 summary 는 빈 문자열입니다.
        """
    )
    @PostMapping(value = "/analyze-area", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AreaAnalysisResponse> analyze(@Valid @RequestBody AreaAnalysisRequest request) {
        return analysisService.analyze(request);
    }

    @Operation(
            summary = "경계 + POI GeoJSON",
            description = "경계 폴리곤과 POI 포인트를 담은 FeatureCollection. colorMode=RAW_CATEGORY 면 예전 팔레트."
    )
    @PostMapping(value = "/api/areas/geometry", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FeatureCollection> geometry(@Valid @RequestBody AreaAnalysisRequest request,
                                            @RequestParam(defaultValue = "SUPER_CATEGORY") ColorMode colorMode) {
        return analysisService.geometry(request, colorMode);
    }
}
