package com.yerin.collector.global.exception.code;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getMessage();
    String getCode();

    default ErrorCode withDetail(String detailMessage) {
        ErrorCode base = this;
        return new ErrorCode() {
            @Override
            public HttpStatus getHttpStatus() {
                return base.getHttpStatus();
            }

            @Override
            public String getMessage() {
                return detailMessage;
            }

            @Override
            public String getCode() {
                return base.getCode();
            }
        };
    }
}
