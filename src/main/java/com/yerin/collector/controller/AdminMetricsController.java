package com.yerin.collector.controller;

import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.infra.WorkerScheduler;
import com.yerin.collector.service.AdminJobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final AdminJobService adminJobService;
    private final WorkerScheduler scheduler;

    @GetMapping("/jobs")
    public Map<JobStatus, Long> jobCounts(@RequestHeader(value = "X-Admin-Token")
                                          @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                          String adminToken) {
        return adminJobService.totals();
    }

    @GetMapping("/workers")
    public Map<String, Object> workers(@RequestHeader(value = "X-Admin-Token")
                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                       String adminToken) {
        return Map.of(
                "maxWorkers", adminJobService.capacity(),
                "runningHere", scheduler.runningCount(),
                "ts", Instant.now().toString()
        );
    }
}
