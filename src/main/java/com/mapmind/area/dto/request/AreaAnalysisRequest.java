package com.mapmind.area.dto.request;

import jakarta.validation.constraints.NotBlank;

public record AreaAnalysisRequest(
        @NotBlank String city,
        @NotBlank String area
) {}
