package com.yerin.collector.application.worker;

import com.yerin.collector.application.BasicWorker;
import com.yerin.collector.application.EnsureJob;
import com.yerin.collector.application.WorkerJob;
import com.yerin.collector.service.ExpirationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * 만료된 데이터셋, 사용자, 알림을 지운다. 각 스윕의 실패는 다른 스윕을 막지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirationWorker extends BasicWorker {

    public static final String TYPE = "expire-datasets";

    private final ExpirationService expirationService;

    @Value("${collector.expiration.interval-seconds:300}")
    private long intervalSeconds = 300;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<EnsureJob> ensureJob() {
        return Optional.of(new EnsureJob("localhost", intervalSeconds));
    }

    @Override
    protected void work(WorkerJob job) {
        sweep("datasets", expirationService::expireDatasets);
        sweep("users", expirationService::expireUsers);
        sweep("notifications", expirationService::expireNotifications);
    }

    private void sweep(String name, IntSupplier sweep) {
        try {
            int n = sweep.getAsInt();
            log.debug("[Worker.{}] {} sweep removed {}", TYPE, name, n);
        } catch (RuntimeException e) {
            log.error("[Worker.{}] {} sweep failed", TYPE, name, e);
        }
    }
}
