package com.mapmind.area.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 파이 차트 한 조각. 프론트(recharts)가 name/value 키를 기대한다.
 */
public record ChartEntry(
        @JsonProperty("name") String label,
        @JsonProperty("value") int count,
        String color
) {}
