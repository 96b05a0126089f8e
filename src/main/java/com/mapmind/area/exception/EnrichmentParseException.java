package com.mapmind.area.exception;

import org.springframework.http.HttpStatus;

/**
 * 생성형 모델 응답에 JSON 이 없거나, 파싱이 안 되거나, 기대한 모양이 아닌 경우.
 */
public class EnrichmentParseException extends AreaAnalysisException {

    public EnrichmentParseException(String stage, String message) {
        this(stage, message, null);
    }

    public EnrichmentParseException(String stage, String message, Throwable cause) {
        super(stage, HttpStatus.BAD_GATEWAY, message, cause);
    }

    @Override
    public String code() {
        return "ENRICHMENT_PARSE_ERROR";
    }
}
