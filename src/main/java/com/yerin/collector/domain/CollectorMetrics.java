package com.yerin.collector.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class CollectorMetrics {

    private final MeterRegistry registry;

    private final Counter jobCreated;
    private final Counter jobClaimed;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobRescheduled;
    private final Counter jobReclaimed;

    public CollectorMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobCreated     = Counter.builder("collector_jobs_created_total")
                .description("jobs inserted into the queue").register(registry);
        this.jobClaimed     = Counter.builder("collector_jobs_claimed_total")
                .description("jobs claimed by a worker slot").register(registry);
        this.jobSucceeded   = Counter.builder("collector_jobs_succeeded_total")
                .description("worker runs that returned normally").register(registry);
        this.jobFailed      = Counter.builder("collector_jobs_failed_total")
                .description("worker runs that threw").register(registry);
        this.jobRescheduled = Counter.builder("collector_jobs_rescheduled_total")
                .description("jobs put back in the queue after a run").register(registry);
        this.jobReclaimed   = Counter.builder("collector_jobs_reclaimed_total")
                .description("stale claims returned to the queue").register(registry);
    }

    public void incCreated()     { jobCreated.increment(); }
    public void incClaimed()     { jobClaimed.increment(); }
    public void incSucceeded()   { jobSucceeded.increment(); }
    public void incFailed()      { jobFailed.increment(); }
    public void incRescheduled() { jobRescheduled.increment(); }
    public void incReclaimed(int n) { jobReclaimed.increment(n); }

    // 타입 태그가 붙은 타이머
    public Timer workerTimer(String type) {
        return Timer.builder("collector_worker_duration_seconds")
                .description("worker run duration by type")
                .tag("type", type)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
