package com.mapmind.area.exception;

import org.springframework.http.HttpStatus;

/**
 * Overpass 쿼리 자체가 실패한 경우 (전송 오류, 비정상 status, 타임아웃).
 * 개별 element 파싱 실패는 여기 해당하지 않는다.
 */
public class PoiSourceException extends AreaAnalysisException {

    public static final String STAGE = "poi-extraction";

    public PoiSourceException(String message, Throwable cause) {
        super(STAGE, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    @Override
    public String code() {
        return "POI_SOURCE_ERROR";
    }
}
