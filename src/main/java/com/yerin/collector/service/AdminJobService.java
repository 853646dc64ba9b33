package com.yerin.collector.service;

import com.yerin.collector.application.JobHandlerRegistry;
import com.yerin.collector.domain.JobQueuePort;
import com.yerin.collector.domain.JobRef;
import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.global.exception.AppException;
import com.yerin.collector.global.exception.code.JobErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AdminJobService {
    private final JobQueuePort queue;
    private final JobHandlerRegistry registry;

    public JobRef enqueue(String type, String remoteId, long intervalSeconds) {
        if (registry.get(type) == null) {
            throw new AppException(JobErrorCode.UNKNOWN_JOB_TYPE);
        }
        if (intervalSeconds < 0) {
            throw new AppException(JobErrorCode.INVALID_INTERVAL);
        }
        return queue.enqueueIfAbsent(type, remoteId, intervalSeconds);
    }

    public int releaseStale(Duration timeout) {
        return queue.releaseStale(timeout);
    }

    public Map<String, Map<JobStatus, Long>> countsByType() {
        return queue.countsByTypeAndStatus();
    }

    public Map<JobStatus, Long> totals() {
        Map<JobStatus, Long> out = new LinkedHashMap<>();
        for (JobStatus s : JobStatus.values()) out.put(s, 0L);
        queue.countsByTypeAndStatus().values()
                .forEach(byStatus -> byStatus.forEach((s, n) -> out.merge(s, n, Long::sum)));
        return out;
    }

    public Map<String, Integer> capacity() {
        return registry.maxWorkersByType();
    }
}
