package com.yerin.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.collector.domain.Dataset;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatasetResponse(
        String key,
        String parentKey,
        String type,
        String owner,
        String datasource,
        Map<String, Object> parameters,
        String status,
        Integer numRows,
        Boolean finished,
        Instant createdAt,
        Instant expiresAfter
) {
    public static DatasetResponse from(Dataset d) {
        return new DatasetResponse(
                d.getKey(),
                d.getParentKey(),
                d.getType(),
                d.getOwner(),
                d.getDatasource(),
                d.getParameters(),
                d.getStatus(),
                d.getNumRows(),
                d.isFinished(),
                d.getCreatedAt(),
                d.getExpiresAfter()
        );
    }
}
