package com.yerin.collector.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    UNKNOWN_JOB_TYPE(HttpStatus.BAD_REQUEST, "등록되지 않은 작업 타입입니다.", "JOB-001"),
    INVALID_INTERVAL(HttpStatus.BAD_REQUEST, "반복 주기는 0 이상이어야 합니다.", "JOB-002");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
