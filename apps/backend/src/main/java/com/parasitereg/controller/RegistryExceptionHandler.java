package com.parasitereg.controller;

import com.parasitereg.api.dto.ErrorResponse;
import com.parasitereg.registry.RegistryError;
import com.parasitereg.registry.RegistryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把错误类别映射为 HTTP 状态码，响应体保留具体类别，不退化成通用错误。
 */
@Slf4j
@RestControllerAdvice
public class RegistryExceptionHandler {

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> onRegistryError(RegistryException e) {
        HttpStatus status = statusOf(e.getError());
        log.debug("[HTTP][ERROR] {} -> {} {}", e.getError(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    static HttpStatus statusOf(RegistryError error) {
        return switch (error) {
            case NOT_AUTHORIZED, NOT_VERIFIED -> HttpStatus.FORBIDDEN;
            case INVALID_RECORD, INVALID_INSTITUTION -> HttpStatus.NOT_FOUND;
            case DUPLICATE_INSTITUTION -> HttpStatus.CONFLICT;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
        };
    }
}
