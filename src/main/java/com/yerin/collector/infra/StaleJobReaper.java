package com.yerin.collector.infra;

import com.yerin.collector.domain.JobQueuePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * heartbeat 가 끊긴 점유 작업을 큐로 돌려보낸다. 죽은 워커 복구의 유일한 경로.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleJobReaper {

    private final JobQueuePort queue;

    @Value("${collector.scheduler.stale-timeout:5m}")
    private Duration staleTimeout = Duration.ofMinutes(5);

    @Scheduled(fixedDelayString = "${collector.scheduler.reap-millis:30000}")
    public void reap() {
        try {
            int n = queue.releaseStale(staleTimeout);
            if (n > 0) log.info("[Reaper] recovered={} stale job(s)", n);
        } catch (DataAccessException e) {
            log.warn("[Reaper] release failed: {}", e.toString());
        }
    }
}
