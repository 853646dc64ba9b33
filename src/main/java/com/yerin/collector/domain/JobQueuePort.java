package com.yerin.collector.domain;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 영속 작업 큐. 점유(claim)는 저장소에 대한 조건부 갱신으로만 이루어진다.
 */
public interface JobQueuePort {

    /** 이 프로세스가 점유한 작업에 기록되는 식별자 */
    String workerId();

    /**
     * (type, remoteId) 로 대기 중인 작업이 없을 때만 넣는다. 이미 있으면 그 작업을 돌려준다.
     */
    JobRef enqueueIfAbsent(String type, String remoteId, long intervalSeconds);

    /**
     * 타입별 실행 중 개수가 상한 미만인 타입에서 실행 가능한 작업 하나를 원자적으로 점유한다.
     */
    Optional<Job> claimNext(Collection<String> types, Map<String, Integer> maxPerType);

    void markRunning(Job job);

    boolean heartbeat(Long jobId, String workerId);

    /**
     * rescheduleAfterSeconds 가 0 이하면 삭제, 아니면 now + rescheduleAfterSeconds 에 다시 대기시킨다.
     */
    void complete(Job job, long rescheduleAfterSeconds);

    /** 워커 실패를 작업 이벤트 로그에 남긴다. 작업 상태는 바꾸지 않는다. */
    void recordFailure(Job job, String error);

    /**
     * heartbeat 가 timeout 이상 끊긴 점유 작업을 회수한다.
     * @return 회수한 작업 수
     */
    int releaseStale(Duration timeout);

    int cancelQueued(Collection<String> remoteIds);

    void registerType(String type, int maxWorkers);

    Map<String, Map<JobStatus, Long>> countsByTypeAndStatus();
}
