package com.yerin.collector.controller;

import com.yerin.collector.dto.DatasetResponse;
import com.yerin.collector.global.dto.DataResponse;
import com.yerin.collector.service.DatasetService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/datasets")
public class AdminDatasetController {

    private final DatasetService datasetService;

    @GetMapping("/{key}")
    public ResponseEntity<DataResponse<DatasetResponse>> get(@PathVariable String key,
                                                             @RequestHeader(value = "X-Admin-Token")
                                                             @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                             String adminToken) {
        return ResponseEntity.ok(DataResponse.from(DatasetResponse.from(datasetService.get(key))));
    }

    /** 하위 데이터셋까지 지운다. 없는 키여도 200 (deleted=false). */
    @DeleteMapping("/{key}")
    public ResponseEntity<DataResponse<Map<String, Boolean>>> delete(@PathVariable String key,
                                                                     @RequestHeader(value = "X-Admin-Token")
                                                                     @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                     String adminToken) {
        boolean deleted = datasetService.delete(key);
        return ResponseEntity.ok(DataResponse.from(Map.of("deleted", deleted)));
    }
}
