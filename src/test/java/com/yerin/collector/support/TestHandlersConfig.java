package com.yerin.collector.support;

import com.yerin.collector.application.BasicWorker;
import com.yerin.collector.application.JobHandler;
import com.yerin.collector.application.WorkerJob;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실행된 remoteId 를 기록하는 테스트용 워커. "fail-" 로 시작하면 예외를 던진다.
 */
@TestConfiguration
public class TestHandlersConfig {

    public static final String TYPE = "test-echo";

    public static final List<String> SEEN = new CopyOnWriteArrayList<>();

    @Bean
    public JobHandler echoTestHandler() {
        return new BasicWorker() {
            @Override public String type() { return TYPE; }
            @Override public int maxWorkers() { return 2; }

            @Override
            protected void work(WorkerJob job) {
                SEEN.add(job.getRemoteId());
                if (job.getRemoteId().startsWith("fail-")) {
                    throw new IllegalStateException("simulated failure");
                }
            }
        };
    }
}
