package com.mapmind.area.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 분석 파이프라인 단계별 실패의 공통 부모.
 * stage 는 에러 응답에 그대로 실려 나간다.
 */
@Getter
public abstract class AreaAnalysisException extends RuntimeException {

    private final String stage;
    private final HttpStatus status;

    protected AreaAnalysisException(String stage, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.status = status;
    }

    /** 에러 응답의 error 코드 */
    public abstract String code();
}
