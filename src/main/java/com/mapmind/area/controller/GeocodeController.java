package com.mapmind.area.controller;

import com.mapmind.area.dto.response.GeocodeResponse;
import com.mapmind.area.service.AreaAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "지오코딩", description = "area, city → 좌표/bbox")
@RestController
@RequestMapping("/api/geocode")
@RequiredArgsConstructor
public class GeocodeController {

    private final AreaAnalysisService analysisService;

    @Operation(summary = "지역 지오코딩", description = "extent 가 없으면 중심 기준 약 1km 정사각형 bbox 를 돌려줍니다.")
    @GetMapping
    public Mono<GeocodeResponse> geocode(@RequestParam String area, @RequestParam String city) {
        return analysisService.resolve(area, city).map(GeocodeResponse::withBbox);
    }
}
