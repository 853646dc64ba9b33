package com.yerin.collector.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "잘못된 요청입니다.", "COMMON-001"),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 파라미터가 잘못되었습니다.", "COMMON-002"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "리소스를 찾을 수 없습니다.", "COMMON-003"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "관리자 토큰이 필요합니다.", "COMMON-004"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "저장소에 연결할 수 없습니다.", "COMMON-005"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부에서 에러가 발생했습니다.", "COMMON-006");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
