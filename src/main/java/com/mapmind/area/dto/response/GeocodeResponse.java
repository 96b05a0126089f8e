package com.mapmind.area.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mapmind.area.model.BoundingBox;
import com.mapmind.area.model.ResolvedArea;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeocodeResponse(
        double lat,
        double lon,
        @JsonProperty("display_name") String displayName,
        BoundingBox bbox     // 분석 응답 안에서는 최상위 bbox 와 중복이라 null
) {

    public static GeocodeResponse of(ResolvedArea area) {
        return new GeocodeResponse(area.coordinate().lat(), area.coordinate().lon(), area.displayName(), null);
    }

    public static GeocodeResponse withBbox(ResolvedArea area) {
        return new GeocodeResponse(area.coordinate().lat(), area.coordinate().lon(), area.displayName(),
                area.boundingBox());
    }
}
