package com.yerin.collector.controller;

import com.yerin.collector.domain.JobRef;
import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.global.dto.DataResponse;
import com.yerin.collector.service.AdminJobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/jobs")
public class AdminJobController {
    private final AdminJobService adminJobService;

    @GetMapping
    public ResponseEntity<DataResponse<Map<String, Map<JobStatus, Long>>>> counts(
            @RequestHeader(value = "X-Admin-Token")
            @Parameter(description = "관리자 토큰", example = "test-admin-token")
            String adminToken) {
        return ResponseEntity.ok(DataResponse.from(adminJobService.countsByType()));
    }

    @PostMapping("/{type}")
    public ResponseEntity<DataResponse<JobRef>> enqueue(@PathVariable String type,
                                                        @RequestParam String remoteId,
                                                        @RequestParam(defaultValue = "0") long interval,
                                                        @RequestHeader(value = "X-Admin-Token")
                                                        @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                        String adminToken) {
        JobRef ref = adminJobService.enqueue(type, remoteId, interval);
        return ResponseEntity.ok(DataResponse.from(ref));
    }

    @PostMapping("/release-stale")
    public ResponseEntity<DataResponse<Map<String, Integer>>> releaseStale(
            @RequestParam(defaultValue = "300") long timeoutSeconds,
            @RequestHeader(value = "X-Admin-Token")
            @Parameter(description = "관리자 토큰", example = "test-admin-token")
            String adminToken) {
        int released = adminJobService.releaseStale(Duration.ofSeconds(timeoutSeconds));
        return ResponseEntity.ok(DataResponse.from(Map.of("released", released)));
    }
}
