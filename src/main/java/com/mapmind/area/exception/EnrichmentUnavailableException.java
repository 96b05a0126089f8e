package com.mapmind.area.exception;

import org.springframework.http.HttpStatus;

/**
 * 생성형 모델 호출 실패/타임아웃/미설정.
 */
public class EnrichmentUnavailableException extends AreaAnalysisException {

    public EnrichmentUnavailableException(String stage, String message, Throwable cause) {
        super(stage, HttpStatus.BAD_GATEWAY, message, cause);
    }

    @Override
    public String code() {
        return "ENRICHMENT_UNAVAILABLE";
    }
}
