package com.yerin.collector.application;

/**
 * 워커 타입이 항상 하나씩 대기시켜 두길 원하는 반복 작업 선언.
 */
public record EnsureJob(String remoteId, long intervalSeconds) {

    public EnsureJob {
        if (remoteId == null || remoteId.isBlank()) throw new IllegalArgumentException("remoteId is required");
        if (intervalSeconds <= 0) throw new IllegalArgumentException("interval must be positive");
    }
}
