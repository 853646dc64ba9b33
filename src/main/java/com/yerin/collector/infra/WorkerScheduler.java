package com.yerin.collector.infra;

import com.yerin.collector.application.JobHandler;
import com.yerin.collector.application.JobHandlerRegistry;
import com.yerin.collector.application.WorkerJob;
import com.yerin.collector.domain.CollectorMetrics;
import com.yerin.collector.domain.Job;
import com.yerin.collector.domain.JobQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 큐에서 작업을 점유해 타입에 맞는 워커에 넘긴다.
 * <p>
 * 타입별 동시 실행 상한은 점유 단계(JobQueuePort#claimNext)에서 지켜진다. 이 클래스가 들고 있는
 * 상태는 이 프로세스에서 실행 중인 작업 목록(heartbeat 용)과 저장소 장애 시 백오프뿐이다.
 */
@Slf4j
@Component
public class WorkerScheduler {

    private final JobQueuePort queue;
    private final JobHandlerRegistry registry;
    private final CollectorMetrics metrics;
    private final TaskExecutor executor;
    private final String workerId;

    private final Map<Long, Job> running = new ConcurrentHashMap<>();

    /** 슬롯 등록 전에는 점유하지 않는다. */
    private volatile boolean bootstrapped = false;
    private volatile int consecutiveFailures = 0;
    private volatile long pausedUntil = 0L;

    @Value("${collector.scheduler.seed-on-startup:true}")
    private boolean seedOnStartup = true;

    @Value("${collector.scheduler.reseed-on-completion:true}")
    private boolean reseedOnCompletion = true;

    @Value("${collector.retry.base-backoff-millis:1000}")
    private long baseBackoffMillis = 1000L;

    @Value("${collector.retry.backoff-cap-millis:60000}")
    private long backoffCapMillis = 60000L;

    @Value("${collector.retry.jitter-ratio:0.2}")
    private double jitterRatio = 0.2;

    public WorkerScheduler(JobQueuePort queue,
                           JobHandlerRegistry registry,
                           CollectorMetrics metrics,
                           @Qualifier("workerExecutor") TaskExecutor executor) {
        this.queue = queue;
        this.registry = registry;
        this.metrics = metrics;
        this.executor = executor;
        this.workerId = queue.workerId();
    }

    /**
     * 타입별 슬롯을 등록하고 ensure 작업을 심는다.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void bootstrap() {
        for (JobHandler handler : registry.handlers()) {
            queue.registerType(handler.type(), handler.maxWorkers());
            if (seedOnStartup) ensure(handler);
        }
        bootstrapped = true;
        log.info("[Scheduler] registered {} worker type(s): {}", registry.types().size(), registry.types());
    }

    @Scheduled(initialDelayString = "${collector.scheduler.initial-delay-millis:1000}",
            fixedDelayString = "${collector.scheduler.poll-millis:1000}")
    public void dispatch() {
        if (!bootstrapped) return;
        if (System.currentTimeMillis() < pausedUntil) return;
        try {
            int dispatched = 0;
            while (true) {
                Optional<Job> claimed = queue.claimNext(registry.types(), registry.maxWorkersByType());
                if (claimed.isEmpty()) break;
                submit(claimed.get());
                dispatched++;
            }
            if (dispatched > 0) log.debug("[Scheduler] dispatched {} job(s)", dispatched);
            consecutiveFailures = 0;
        } catch (DataAccessException e) {
            int failures = ++consecutiveFailures;
            Duration wait = Backoff.expJitter(failures - 1, baseBackoffMillis, backoffCapMillis, jitterRatio);
            pausedUntil = System.currentTimeMillis() + wait.toMillis();
            log.error("[Scheduler] queue unavailable (failure #{}), pausing {} ms: {}", failures, wait.toMillis(), e.toString());
        }
    }

    @Scheduled(fixedDelayString = "${collector.scheduler.heartbeat-millis:10000}")
    public void heartbeat() {
        for (Long jobId : running.keySet()) {
            touch(jobId);
        }
    }

    public int runningCount() {
        return running.size();
    }

    private void submit(Job job) {
        running.put(job.getId(), job);
        try {
            executor.execute(() -> run(job));
        } catch (TaskRejectedException e) {
            // 풀이 닫히는 중. heartbeat 가 끊기면 reaper 가 회수한다.
            running.remove(job.getId());
            log.warn("[Scheduler] executor rejected jobId={}, type={}", job.getId(), job.getType());
        }
    }

    void run(Job job) {
        JobHandler handler = registry.get(job.getType());
        WorkerJob workerJob = new WorkerJob(job, this::touch);
        long start = System.nanoTime();
        try {
            if (handler == null) {
                log.error("[Scheduler] no worker registered for type={}, dropping jobId={}", job.getType(), job.getId());
                return;
            }
            queue.markRunning(job);
            log.info("[Scheduler] running jobId={}, type={}, remoteId={}, attempt={}",
                    job.getId(), job.getType(), job.getRemoteId(), job.getAttempts());
            handler.handle(workerJob);
            metrics.incSucceeded();
        } catch (Exception e) {
            metrics.incFailed();
            log.error("[Scheduler] worker failed jobId={}, type={}, remoteId={}",
                    job.getId(), job.getType(), job.getRemoteId(), e);
            recordFailure(job, e);
        } finally {
            metrics.workerTimer(job.getType()).record(Duration.ofNanos(System.nanoTime() - start));
            finishJob(job, handler, workerJob);
            running.remove(job.getId());
        }
    }

    private void finishJob(Job job, JobHandler handler, WorkerJob workerJob) {
        try {
            queue.complete(job, workerJob.rescheduleAfterSeconds());
            if (reseedOnCompletion && handler != null) ensure(handler);
        } catch (DataAccessException e) {
            log.error("[Scheduler] could not complete jobId={}, left for stale recovery: {}", job.getId(), e.toString());
        }
    }

    private void recordFailure(Job job, Exception error) {
        try {
            queue.recordFailure(job, error.toString());
        } catch (DataAccessException e) {
            log.warn("[Scheduler] could not record failure jobId={}: {}", job.getId(), e.toString());
        }
    }

    private void ensure(JobHandler handler) {
        handler.ensureJob().ifPresent(e -> queue.enqueueIfAbsent(handler.type(), e.remoteId(), e.intervalSeconds()));
    }

    private void touch(Long jobId) {
        try {
            if (!queue.heartbeat(jobId, workerId)) {
                log.warn("[Scheduler] heartbeat rejected jobId={}, claim was taken over", jobId);
            }
        } catch (DataAccessException e) {
            log.warn("[Scheduler] heartbeat failed jobId={}: {}", jobId, e.toString());
        }
    }
}
