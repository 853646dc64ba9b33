package com.yerin.collector.application;

import com.yerin.collector.domain.Job;

import java.util.function.Consumer;

/**
 * 한 번의 실행 동안 워커에게 주어지는 작업 핸들.
 * 스케줄러는 실행이 끝나면 retryAfter 로 요청된 지연 또는 작업의 반복 주기로 complete 를 호출한다.
 */
public class WorkerJob {

    private final Long id;
    private final String type;
    private final String remoteId;
    private final int attempts;
    private final long intervalSeconds;
    private final Consumer<Long> heartbeat;

    private volatile boolean finished;
    private volatile long retryAfterSeconds;

    public WorkerJob(Job job, Consumer<Long> heartbeat) {
        this.id = job.getId();
        this.type = job.getType();
        this.remoteId = job.getRemoteId();
        this.attempts = job.getAttempts();
        this.intervalSeconds = job.getIntervalSeconds();
        this.heartbeat = heartbeat;
    }

    public Long getId() { return id; }
    public String getType() { return type; }
    public String getRemoteId() { return remoteId; }
    public int getAttempts() { return attempts; }

    public void finish() {
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * 이번 실행을 끝내고 seconds 뒤에 같은 작업을 다시 실행하도록 요청한다.
     */
    public void retryAfter(long seconds) {
        this.retryAfterSeconds = Math.max(0, seconds);
        finished = true;
    }

    public void heartbeat() {
        heartbeat.accept(id);
    }

    /** complete 에 넘길 재예약 지연(초). 0 이면 삭제. */
    public long rescheduleAfterSeconds() {
        return retryAfterSeconds > 0 ? retryAfterSeconds : intervalSeconds;
    }
}
