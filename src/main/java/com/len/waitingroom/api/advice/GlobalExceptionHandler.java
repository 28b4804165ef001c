package com.len.waitingroom.api.advice;

import com.len.waitingroom.common.exception.BusinessException;
import com.len.waitingroom.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        if (ec.getHttpStatus().is5xxServerError()) {
            log.error("[{}] {} {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e);
        } else {
            log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        }
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, e.getMessage(), req.getRequestURI()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception e, HttpServletRequest req) {
        ErrorCode ec = ErrorCode.INVALID_REQUEST;
        log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, ec.getMessage(), req.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        ErrorCode ec = ErrorCode.INTERNAL_ERROR;
        log.error("[{}] {} {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e);
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, ec.getMessage(), req.getRequestURI()));
    }
}
