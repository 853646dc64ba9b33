package com.yerin.collector.infra;

import com.yerin.collector.domain.Job;
import com.yerin.collector.domain.JobRef;
import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.repository.JobEventLogRepository;
import com.yerin.collector.repository.JobRepository;
import com.yerin.collector.repository.WorkerSlotRepository;
import com.yerin.collector.support.PersistenceTestConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import(PersistenceTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("JPA 작업 큐 테스트")
class JpaJobQueueTest {

    private static final String SCRAPE = "scrape";
    private static final Map<String, Integer> LIMITS = Map.of(SCRAPE, 2);

    @Autowired JpaJobQueue queue;
    @Autowired JobRepository jobRepository;
    @Autowired WorkerSlotRepository slotRepository;
    @Autowired JobEventLogRepository logRepository;
    @Autowired PlatformTransactionManager txManager;
    @Autowired MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAllInBatch();
        slotRepository.deleteAllInBatch();
        logRepository.deleteAllInBatch();
        queue.registerType(SCRAPE, 2);
    }

    @Test
    @DisplayName("같은 (type, remoteId) 는 한 번만 대기열에 들어간다")
    void enqueue_is_deduplicated() {
        JobRef first = queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        JobRef second = queue.enqueueIfAbsent(SCRAPE, "thread-1", 60);

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(jobRepository.count()).isEqualTo(1);
        // 기존 행의 주기는 바뀌지 않는다
        assertThat(jobRepository.findById(first.id()).orElseThrow().getIntervalSeconds()).isZero();
    }

    @Test
    @DisplayName("점유하면 CLAIMED, 시도 횟수 1, dedup 키는 비워진다")
    void claim_marks_job_claimed() {
        JobRef ref = queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);

        Job claimed = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        assertThat(claimed.getId()).isEqualTo(ref.id());
        assertThat(claimed.getStatus()).isEqualTo(JobStatus.CLAIMED);
        assertThat(claimed.getAttempts()).isEqualTo(1);
        assertThat(claimed.getDedupKey()).isNull();
        assertThat(claimed.getClaimedBy()).isEqualTo(queue.workerId());
        assertThat(logRepository.findByJobIdOrderByIdAsc(ref.id()))
                .extracting("eventType").containsExactly("CLAIMED");

        // 실행 중인 작업과 같은 작업은 새로 대기열에 들어갈 수 있다
        JobRef again = queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        assertThat(again.created()).isTrue();
        assertThat(again.id()).isNotEqualTo(ref.id());
    }

    @Test
    @DisplayName("타입 상한(2)을 넘어서 점유하지 않는다")
    void claim_respects_type_limit() {
        for (int i = 0; i < 5; i++) queue.enqueueIfAbsent(SCRAPE, "thread-" + i, 0);

        Optional<Job> a = queue.claimNext(List.of(SCRAPE), LIMITS);
        Optional<Job> b = queue.claimNext(List.of(SCRAPE), LIMITS);
        Optional<Job> c = queue.claimNext(List.of(SCRAPE), LIMITS);

        assertThat(a).isPresent();
        assertThat(b).isPresent();
        assertThat(c).isEmpty();

        queue.complete(a.get(), 0);
        assertThat(queue.claimNext(List.of(SCRAPE), LIMITS)).isPresent();
    }

    @Test
    @DisplayName("같은 remoteId 가 실행 중이면 새로 들어온 행은 상한이 남아도 점유하지 않는다")
    void claim_skips_remote_id_already_active() {
        queue.enqueueIfAbsent(SCRAPE, "ds1", 0);
        Job first = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        JobRef again = queue.enqueueIfAbsent(SCRAPE, "ds1", 0);
        JobRef other = queue.enqueueIfAbsent(SCRAPE, "ds2", 0);

        Job second = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        assertThat(second.getId()).isEqualTo(other.id());
        assertThat(jobRepository.findById(again.id()).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);

        queue.complete(first, 0);
        queue.complete(second, 0);
        Job third = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        assertThat(third.getId()).isEqualTo(again.id());
    }

    @Test
    @DisplayName("여러 스레드가 동시에 점유해도 상한을 넘지 않는다")
    void concurrent_claims_respect_limit() throws Exception {
        for (int i = 0; i < 6; i++) queue.enqueueIfAbsent(SCRAPE, "thread-" + i, 0);

        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger claimed = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int attempt = 0; attempt < 3; attempt++) {
                    try {
                        if (queue.claimNext(List.of(SCRAPE), LIMITS).isPresent()) claimed.incrementAndGet();
                    } catch (DataAccessException lockTimeout) {
                        // 잠금 대기 시간 초과는 다음 시도로
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(claimed.get()).isEqualTo(2);
        assertThat(jobRepository.countByTypeAndStatusIn(SCRAPE, JobStatus.ACTIVE)).isEqualTo(2);
        assertThat(jobRepository.countByStatus(JobStatus.QUEUED)).isEqualTo(4);
    }

    @Test
    @DisplayName("대기 작업이 없거나 슬롯이 등록되지 않은 타입은 점유하지 않는다")
    void claim_skips_empty_and_unregistered() {
        assertThat(queue.claimNext(List.of(SCRAPE), LIMITS)).isEmpty();

        queue.enqueueIfAbsent("unregistered", "x", 0);
        assertThat(queue.claimNext(List.of("unregistered"), Map.of("unregistered", 1))).isEmpty();
    }

    @Test
    @DisplayName("일회성 작업은 완료하면 삭제된다")
    void complete_one_shot_deletes() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        queue.complete(job, 0);

        assertThat(jobRepository.findById(job.getId())).isEmpty();
        assertThat(logRepository.findByJobIdOrderByIdAsc(job.getId()))
                .extracting("eventType").containsExactly("CLAIMED", "COMPLETED");
    }

    @Test
    @DisplayName("반복 작업은 완료 후 now + interval 에 다시 대기한다")
    void complete_recurring_requeues() {
        queue.enqueueIfAbsent(SCRAPE, "board", 60);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        Instant before = Instant.now();
        queue.complete(job, 60);
        Instant after = Instant.now();

        Job requeued = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(requeued.getDedupKey()).isEqualTo(Job.dedupKey(SCRAPE, "board"));
        assertThat(requeued.getClaimedBy()).isNull();
        assertThat(requeued.getNextAttemptAt())
                .isAfterOrEqualTo(before.plusSeconds(60).truncatedTo(ChronoUnit.MILLIS))
                .isBeforeOrEqualTo(after.plusSeconds(61));
        assertThat(queue.claimNext(List.of(SCRAPE), LIMITS)).isEmpty();
        assertThat(meterRegistry.find("collector_jobs_rescheduled_total").counter().count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("실행 중에 같은 작업이 다시 들어왔으면 완료 시 이 행은 삭제된다")
    void complete_with_duplicate_deletes() {
        queue.enqueueIfAbsent(SCRAPE, "board", 60);
        Job running = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        JobRef fresh = queue.enqueueIfAbsent(SCRAPE, "board", 60);

        queue.complete(running, 60);

        assertThat(jobRepository.findById(running.getId())).isEmpty();
        assertThat(jobRepository.findAll()).extracting(Job::getId).containsExactly(fresh.id());
    }

    @Test
    @DisplayName("워커 실패는 FAILED 이벤트로 남고 작업은 그대로다")
    void record_failure_appends_event() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        queue.recordFailure(job, "java.lang.IllegalStateException: boom");

        assertThat(logRepository.findByJobIdOrderByIdAsc(job.getId()))
                .extracting("eventType").containsExactly("CLAIMED", "FAILED");
        assertThat(jobRepository.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.CLAIMED);
    }

    @Test
    @DisplayName("heartbeat 는 점유한 워커만 갱신할 수 있다")
    void heartbeat_only_by_owner() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        queue.markRunning(job);

        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(queue.heartbeat(job.getId(), queue.workerId())).isTrue();
        assertThat(queue.heartbeat(job.getId(), "someone-else")).isFalse();
    }

    @Test
    @DisplayName("heartbeat 가 끊긴 작업은 백오프 후 다시 대기한다")
    void release_stale_requeues_with_backoff() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        age(job.getId(), 1);

        Instant before = Instant.now();
        int released = queue.releaseStale(Duration.ofMinutes(5));

        assertThat(released).isEqualTo(1);
        Job requeued = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(requeued.getAttempts()).isEqualTo(1);
        assertThat(requeued.getDedupKey()).isEqualTo(Job.dedupKey(SCRAPE, "thread-1"));
        assertThat(requeued.getNextAttemptAt()).isAfter(before);
        assertThat(meterRegistry.find("collector_jobs_reclaimed_total").counter().count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("최대 시도 횟수를 넘긴 작업은 회수하지 않고 버린다")
    void release_stale_abandons_after_max_attempts() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        age(job.getId(), 5);

        assertThat(queue.releaseStale(Duration.ofMinutes(5))).isZero();
        assertThat(jobRepository.findById(job.getId())).isEmpty();
        assertThat(logRepository.findByJobIdOrderByIdAsc(job.getId()))
                .extracting("eventType").contains("ABANDONED");
    }

    @Test
    @DisplayName("같은 작업이 이미 대기 중이면 끊긴 작업은 삭제된다")
    void release_stale_drops_when_duplicate_queued() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job stale = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        JobRef fresh = queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        age(stale.getId(), 1);

        queue.releaseStale(Duration.ofMinutes(5));

        assertThat(jobRepository.findAll()).extracting(Job::getId).containsExactly(fresh.id());
    }

    @Test
    @DisplayName("살아 있는 점유는 회수하지 않는다")
    void release_stale_ignores_live_claims() {
        queue.enqueueIfAbsent(SCRAPE, "thread-1", 0);
        Job job = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();

        assertThat(queue.releaseStale(Duration.ofMinutes(5))).isZero();
        assertThat(jobRepository.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.CLAIMED);
    }

    @Test
    @DisplayName("cancelQueued 는 대기 중인 작업만 지운다")
    void cancel_queued_only() {
        queue.enqueueIfAbsent(SCRAPE, "a", 0);
        Job running = queue.claimNext(List.of(SCRAPE), LIMITS).orElseThrow();
        queue.enqueueIfAbsent(SCRAPE, "a", 0);
        queue.enqueueIfAbsent(SCRAPE, "b", 0);
        queue.enqueueIfAbsent(SCRAPE, "c", 0);

        int n = queue.cancelQueued(List.of("a", "b"));

        assertThat(n).isEqualTo(2);
        assertThat(jobRepository.findAll())
                .extracting(Job::getRemoteId, Job::getStatus)
                .containsExactlyInAnyOrder(
                        tuple("a", JobStatus.CLAIMED),
                        tuple("c", JobStatus.QUEUED));
        assertThat(running.getRemoteId()).isEqualTo("a");
    }

    @Test
    @DisplayName("타입/상태별 작업 수 집계")
    void counts_by_type_and_status() {
        queue.enqueueIfAbsent(SCRAPE, "a", 0);
        queue.enqueueIfAbsent(SCRAPE, "b", 0);
        queue.enqueueIfAbsent("expire", "localhost", 300);
        queue.claimNext(List.of(SCRAPE), LIMITS);

        Map<String, Map<JobStatus, Long>> counts = queue.countsByTypeAndStatus();

        assertThat(counts.get(SCRAPE)).containsEntry(JobStatus.QUEUED, 1L).containsEntry(JobStatus.CLAIMED, 1L);
        assertThat(counts.get("expire")).containsEntry(JobStatus.QUEUED, 1L);
    }

    @Test
    @DisplayName("registerType 은 상한을 갱신한다")
    void register_type_upserts() {
        queue.registerType(SCRAPE, 4);
        assertThat(slotRepository.findById(SCRAPE).orElseThrow().getMaxWorkers()).isEqualTo(4);
    }

    /** heartbeat 를 10분 전으로 돌리고 시도 횟수를 맞춘다. */
    private void age(Long jobId, int attempts) {
        new TransactionTemplate(txManager).executeWithoutResult(status -> {
            Job j = jobRepository.findById(jobId).orElseThrow();
            j.setHeartbeatAt(Instant.now().minus(Duration.ofMinutes(10)));
            j.setAttempts(attempts);
        });
    }
}
