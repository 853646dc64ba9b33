package com.yerin.collector.global.exception;

import com.yerin.collector.global.dto.ErrorResponse;
import com.yerin.collector.global.exception.code.CommonErrorCode;
import com.yerin.collector.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        log.warn("AppException: {}, path={} {}", errorCode.getMessage(),
                request.getMethod(), request.getRequestURI());
        return respond(errorCode, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e,
                                                                HttpServletRequest request) {
        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(e.getParameterName() + " 파라미터가 필요합니다.");
        log.warn("Missing parameter: {}, path={} {}", e.getParameterName(),
                request.getMethod(), request.getRequestURI());
        return respond(errorCode, request);
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorResponse> handleStoreDown(DataAccessResourceFailureException e,
                                                         HttpServletRequest request) {
        log.error("Persistence unavailable, path={} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(CommonErrorCode.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        return respond(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(ErrorResponse.of(errorCode, request));
    }
}
