package com.yerin.collector.domain;

/**
 * enqueueIfAbsent 결과. created=false 이면 이미 대기 중인 동일 작업을 가리킨다.
 */
public record JobRef(Long id, String type, String remoteId, boolean created) {

    public static JobRef of(Job job, boolean created) {
        return new JobRef(job.getId(), job.getType(), job.getRemoteId(), created);
    }
}
