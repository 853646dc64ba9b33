package com.yerin.collector.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum DatasetErrorCode implements ErrorCode {
    DATASET_NOT_FOUND(HttpStatus.NOT_FOUND, "데이터셋을 찾을 수 없습니다.", "DATASET-001");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
