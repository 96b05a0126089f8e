package com.mapmind.area.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 분석 파이프라인 파라미터 (yml 로 조정)
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "mapmind.analysis")
public class AnalysisProperties {

    // --- POI 검색 ---
    private int radiusMeters = 1500;

    // 지오코더가 extent 를 안 줄 때 쓰는 정사각형 반폭 (약 1km)
    private double fallbackHalfWidthDeg = 0.009;

    // --- 생성형 보강 ---
    private boolean geometryEnrichmentEnabled = false;
    private Duration geometryTimeout = Duration.ofSeconds(45);
    private Duration summaryTimeout = Duration.ofSeconds(45);

    // true 면 요약 실패 시 502 (예전 동작), false 면 빈 요약으로 진행
    private boolean summaryRequired = false;
}
