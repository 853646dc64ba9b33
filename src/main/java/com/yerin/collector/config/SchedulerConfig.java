package com.yerin.collector.config;

import com.yerin.collector.application.JobHandlerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SchedulerConfig {

    /**
     * 워커 실행 풀. 점유 단계에서 타입별 상한을 지키므로 풀 크기는 상한의 합이면 충분하다.
     */
    @Bean(name = "workerExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor workerExecutor(JobHandlerRegistry registry) {
        int size = Math.max(1, registry.totalWorkers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
