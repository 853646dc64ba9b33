package com.yerin.collector.application;

/**
 * 처리기에서 데이터셋에 오류로 기록하고 끝낼 실패.
 */
public class ProcessorException extends RuntimeException {

    public ProcessorException(String message) {
        super(message);
    }

    public ProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
