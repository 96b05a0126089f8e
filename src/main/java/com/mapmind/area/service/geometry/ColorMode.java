package com.mapmind.area.service.geometry;

/**
 * POI 포인트 색 지정 방식.
 */
public enum ColorMode {
    /** raw category 순서대로 6색 팔레트 순환 (예전 지도 화면) */
    RAW_CATEGORY,
    /** 상위 카테고리 고정색. 파이 차트와 색이 맞는다 */
    SUPER_CATEGORY
}
