package com.mapmind.area.model;

/**
 * 생성형 요약 결과. rating 은 0~100.
 */
public record AreaSummary(String summary, int rating) {

    public static final AreaSummary EMPTY = new AreaSummary("", 0);

    public AreaSummary {
        summary = (summary == null) ? "" : summary;
        rating = Math.max(0, Math.min(100, rating));
    }
}
