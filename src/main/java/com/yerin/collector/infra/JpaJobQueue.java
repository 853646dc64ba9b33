package com.yerin.collector.infra;

import com.yerin.collector.domain.*;
import com.yerin.collector.repository.JobEventLogRepository;
import com.yerin.collector.repository.JobRepository;
import com.yerin.collector.repository.WorkerSlotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 관계형 저장소 위의 작업 큐.
 * <p>
 * 점유는 타입별 worker_slot 행 잠금 + job 행 CAS 로 한 트랜잭션 안에서 이루어지므로
 * 여러 프로세스가 동시에 claimNext 를 불러도 타입별 상한을 넘지 않는다.
 */
@Slf4j
@Component
public class JpaJobQueue implements JobQueuePort {

    private static final int CLAIM_CANDIDATES = 5;

    private final JobRepository jobRepository;
    private final WorkerSlotRepository slotRepository;
    private final JobEventLogRepository logRepository;
    private final CollectorMetrics metrics;
    private final TransactionTemplate tx;
    private final String workerId;
    private final AtomicInteger rotation = new AtomicInteger();

    @Value("${collector.scheduler.max-attempts:5}")
    private int maxAttempts = 5;

    @Value("${collector.retry.base-backoff-millis:1000}")
    private long baseBackoffMillis = 1000L;

    @Value("${collector.retry.backoff-cap-millis:60000}")
    private long backoffCapMillis = 60000L;

    @Value("${collector.retry.jitter-ratio:0.2}")
    private double jitterRatio = 0.2;

    public JpaJobQueue(JobRepository jobRepository,
                       WorkerSlotRepository slotRepository,
                       JobEventLogRepository logRepository,
                       CollectorMetrics metrics,
                       PlatformTransactionManager txManager) {
        this.jobRepository = jobRepository;
        this.slotRepository = slotRepository;
        this.logRepository = logRepository;
        this.metrics = metrics;
        this.tx = new TransactionTemplate(txManager);
        this.workerId = WorkerId.processName();
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public JobRef enqueueIfAbsent(String type, String remoteId, long intervalSeconds) {
        String dedupKey = Job.dedupKey(type, remoteId);
        Optional<Job> existing = jobRepository.findByDedupKey(dedupKey);
        if (existing.isPresent()) return JobRef.of(existing.get(), false);

        try {
            Job saved = tx.execute(status -> jobRepository.saveAndFlush(Job.builder()
                    .type(type)
                    .remoteId(remoteId)
                    .dedupKey(dedupKey)
                    .intervalSeconds(Math.max(0, intervalSeconds))
                    .status(JobStatus.QUEUED)
                    .attempts(0)
                    .nextAttemptAt(Instant.now())
                    .build()));
            metrics.incCreated();
            log.info("[Queue] enqueued type={}, remoteId={}, interval={}s, jobId={}",
                    type, remoteId, intervalSeconds, saved.getId());
            return JobRef.of(saved, true);
        } catch (DataIntegrityViolationException e) {
            // 동시에 같은 작업이 들어갔다. 이긴 쪽을 돌려준다.
            Job winner = jobRepository.findByDedupKey(dedupKey)
                    .orElseThrow(() -> e);
            log.debug("[Queue] enqueue lost race type={}, remoteId={}", type, remoteId);
            return JobRef.of(winner, false);
        }
    }

    @Override
    public Optional<Job> claimNext(Collection<String> types, Map<String, Integer> maxPerType) {
        if (types.isEmpty()) return Optional.empty();
        List<String> order = new ArrayList<>(types);
        Collections.rotate(order, rotation.getAndIncrement() % order.size());

        for (String type : order) {
            int max = Math.max(1, maxPerType.getOrDefault(type, 1));
            Job claimed = tx.execute(status -> claimForType(type, max).orElse(null));
            if (claimed != null) {
                metrics.incClaimed();
                return Optional.of(claimed);
            }
        }
        return Optional.empty();
    }

    private Optional<Job> claimForType(String type, int max) {
        if (slotRepository.lockByType(type).isEmpty()) {
            log.warn("[Queue] no worker slot registered for type={}, skip", type);
            return Optional.empty();
        }

        long active = jobRepository.countByTypeAndStatusIn(type, JobStatus.ACTIVE);
        if (active >= max) return Optional.empty();

        Instant now = Instant.now();
        List<Job> due = jobRepository.findByTypeAndStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
                type, JobStatus.QUEUED, now, PageRequest.of(0, CLAIM_CANDIDATES));

        for (Job candidate : due) {
            // 슬롯 락 안이므로 같은 대상의 실행 여부 확인과 CAS 사이에 끼어들 수 없다.
            if (jobRepository.existsByTypeAndRemoteIdAndStatusIn(type, candidate.getRemoteId(), JobStatus.ACTIVE)) {
                log.debug("[Queue] skip jobId={}, remoteId={} already active", candidate.getId(), candidate.getRemoteId());
                continue;
            }
            int grabbed = jobRepository.claimIfQueued(candidate.getId(), workerId, now);
            if (grabbed == 0) {
                log.debug("[Queue] lost race jobId={}", candidate.getId());
                continue;
            }
            Job job = jobRepository.findById(candidate.getId()).orElseThrow();
            appendLog(job, "CLAIMED", "attempt " + job.getAttempts() + " by " + workerId);
            return Optional.of(job);
        }
        return Optional.empty();
    }

    @Override
    public void markRunning(Job job) {
        Integer updated = tx.execute(status -> jobRepository.markRunningIfClaimed(job.getId(), Instant.now()));
        if (updated != null && updated > 0) job.setStatus(JobStatus.RUNNING);
    }

    @Override
    public boolean heartbeat(Long jobId, String owner) {
        Integer updated = tx.execute(status -> jobRepository.touchHeartbeat(jobId, owner, Instant.now()));
        return updated != null && updated > 0;
    }

    @Override
    public void complete(Job job, long rescheduleAfterSeconds) {
        if (rescheduleAfterSeconds <= 0) {
            tx.executeWithoutResult(status -> {
                jobRepository.deleteJob(job.getId());
                appendLog(job, "COMPLETED", null);
            });
            return;
        }

        String dedupKey = Job.dedupKey(job.getType(), job.getRemoteId());
        Instant next = Instant.now().plusSeconds(rescheduleAfterSeconds);
        try {
            Boolean requeued = tx.execute(status -> {
                if (jobRepository.existsByDedupKey(dedupKey)) {
                    // 실행 중에 같은 작업이 다시 보장(ensure)되었다. 이 행은 지운다.
                    jobRepository.deleteJob(job.getId());
                    appendLog(job, "COMPLETED", "duplicate already queued");
                    return false;
                }
                int n = jobRepository.requeueIfActive(job.getId(), dedupKey, next, Instant.now());
                if (n > 0) appendLog(job, "RESCHEDULED", "next attempt at " + next);
                return n > 0;
            });
            if (Boolean.TRUE.equals(requeued)) {
                metrics.incRescheduled();
                log.info("[Queue] rescheduled jobId={}, type={}, nextAttemptAt={}", job.getId(), job.getType(), next);
            }
        } catch (DataIntegrityViolationException e) {
            log.debug("[Queue] requeue collided with a fresh duplicate jobId={}", job.getId());
            tx.executeWithoutResult(status -> jobRepository.deleteJob(job.getId()));
        }
    }

    @Override
    public void recordFailure(Job job, String error) {
        tx.executeWithoutResult(status -> appendLog(job, "FAILED", error));
    }

    @Override
    public int releaseStale(Duration timeout) {
        Instant staleBefore = Instant.now().minus(timeout);
        List<Job> stale = jobRepository.findTop100ByStatusInAndHeartbeatAtLessThanOrderByHeartbeatAtAsc(
                JobStatus.ACTIVE, staleBefore);
        if (stale.isEmpty()) return 0;

        int recovered = 0;
        for (Job j : stale) {
            try {
                if (releaseOne(j, staleBefore)) recovered++;
            } catch (DataIntegrityViolationException e) {
                tx.executeWithoutResult(status -> jobRepository.deleteJob(j.getId()));
                log.debug("[Queue] stale jobId={} dropped, duplicate queued meanwhile", j.getId());
            } catch (RuntimeException e) {
                log.warn("[Queue] failed to release stale jobId={}, err={}", j.getId(), e.toString());
            }
        }
        if (recovered > 0) {
            metrics.incReclaimed(recovered);
            log.info("[Queue] released stale={} (CLAIMED/RUNNING→QUEUED)", recovered);
        }
        return recovered;
    }

    private boolean releaseOne(Job j, Instant staleBefore) {
        String dedupKey = Job.dedupKey(j.getType(), j.getRemoteId());
        Boolean released = tx.execute(status -> {
            if (j.getAttempts() >= maxAttempts || jobRepository.existsByDedupKey(dedupKey)) {
                jobRepository.deleteJob(j.getId());
                appendLog(j, "ABANDONED", "attempts=" + j.getAttempts());
                log.warn("[Queue] abandoned stale jobId={}, type={}, attempts={}", j.getId(), j.getType(), j.getAttempts());
                return false;
            }
            Duration wait = Backoff.expJitter(j.getAttempts() - 1, baseBackoffMillis, backoffCapMillis, jitterRatio);
            int n = jobRepository.requeueIfStale(j.getId(), dedupKey, Instant.now().plus(wait), staleBefore, Instant.now());
            if (n > 0) appendLog(j, "RECLAIMED", "claimed by " + j.getClaimedBy());
            return n > 0;
        });
        return Boolean.TRUE.equals(released);
    }

    @Override
    public int cancelQueued(Collection<String> remoteIds) {
        if (remoteIds.isEmpty()) return 0;
        Integer n = tx.execute(status -> jobRepository.deleteQueuedByRemoteIdIn(remoteIds));
        return n == null ? 0 : n;
    }

    @Override
    public void registerType(String type, int maxWorkers) {
        tx.executeWithoutResult(status -> {
            WorkerSlot slot = slotRepository.findById(type)
                    .orElseGet(() -> WorkerSlot.builder().type(type).registeredAt(Instant.now()).build());
            slot.setMaxWorkers(maxWorkers);
            slotRepository.save(slot);
        });
    }

    @Override
    public Map<String, Map<JobStatus, Long>> countsByTypeAndStatus() {
        Map<String, Map<JobStatus, Long>> out = new TreeMap<>();
        for (Object[] row : jobRepository.countGroupedByTypeAndStatus()) {
            out.computeIfAbsent((String) row[0], t -> new EnumMap<>(JobStatus.class))
                    .put((JobStatus) row[1], ((Number) row[2]).longValue());
        }
        return out;
    }

    private void appendLog(Job job, String event, String message) {
        logRepository.save(JobEventLog.builder()
                .jobId(job.getId())
                .jobType(job.getType())
                .eventType(event)
                .message(message)
                .build());
    }
}
