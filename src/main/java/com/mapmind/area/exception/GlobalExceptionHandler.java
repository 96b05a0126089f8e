package com.mapmind.area.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValid(MethodArgumentNotValidException e) {
        return ResponseEntity.badRequest().body(
                Map.of("error", "VALIDATION_ERROR", "message", e.getMessage())
        );
    }

    // 단계 이름을 같이 내려서 어느 upstream 이 죽었는지 바로 보이게
    @ExceptionHandler(AreaAnalysisException.class)
    public ResponseEntity<?> handleAnalysis(AreaAnalysisException e) {
        log.error("[{}] {}", e.getStage(), e.getMessage());
        return ResponseEntity.status(e.getStatus()).body(
                Map.of("error", e.code(),
                        "stage", e.getStage(),
                        "message", String.valueOf(e.getMessage()))
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleAny(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", String.valueOf(e.getMessage())));
    }
}
