package com.mapmind.area.exception;

import org.springframework.http.HttpStatus;

/**
 * 지오코더 매칭 실패 또는 호출 실패. 요청 전체가 실패한다.
 */
public class GeocodeException extends AreaAnalysisException {

    public static final String STAGE = "geocode";

    public GeocodeException(String message) {
        this(message, null);
    }

    public GeocodeException(String message, Throwable cause) {
        super(STAGE, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    @Override
    public String code() {
        return "GEOCODE_ERROR";
    }
}
