package com.yerin.collector.application;

import lombok.extern.slf4j.Slf4j;

/**
 * work() 를 한 번 실행하고 끝나면 finish 를 표시하는 기본 워커.
 * 예외는 스케줄러까지 올라가 로그로 남고 작업은 완료 처리된다.
 */
@Slf4j
public abstract class BasicWorker implements JobHandler {

    @Override
    public final void handle(WorkerJob job) throws Exception {
        long start = System.currentTimeMillis();
        log.debug("[Worker.{}] start jobId={}, remoteId={}", type(), job.getId(), job.getRemoteId());
        work(job);
        if (!job.isFinished()) job.finish();
        log.debug("[Worker.{}] done jobId={} in {}ms", type(), job.getId(), System.currentTimeMillis() - start);
    }

    protected abstract void work(WorkerJob job) throws Exception;
}
