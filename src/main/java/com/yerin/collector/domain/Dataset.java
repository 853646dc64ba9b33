package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 수집/분석 결과 단위. parent_key 로 트리를 이루며, 파라미터 중 조회에 쓰이는 값
 * (datasource, keep, expires-after)은 별도 컬럼으로 동기화해 둔다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "dataset", indexes = {
        @Index(name = "ix_dataset_parent", columnList = "parent_key"),
        @Index(name = "ix_dataset_owner", columnList = "owner"),
        @Index(name = "ix_dataset_datasource", columnList = "datasource, created_at")
})
public class Dataset {

    public static final String PARAM_DATASOURCE = "datasource";
    public static final String PARAM_KEEP = "keep";
    public static final String PARAM_EXPIRES_AFTER = "expires-after";

    /** 9999-12-31T23:59:59Z */
    private static final long MAX_EPOCH_SECONDS = 253402300799L;

    @Id
    @Column(name = "dataset_key", length = 64)
    private String key;

    @Column(name = "parent_key", length = 64)
    private String parentKey;

    @Column(nullable = false, length = 100)
    private String type;

    @Column(length = 200)
    private String owner;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "parameters", nullable = false, columnDefinition = "text")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @Column(length = 100)
    private String datasource;

    @Column(nullable = false)
    private boolean keep;

    @Column(name = "expires_after")
    private Instant expiresAfter;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(columnDefinition = "text")
    private String status;

    @Column(name = "num_rows", nullable = false)
    private int numRows;

    @Column(nullable = false)
    private boolean finished;

    @Column(name = "result_file", length = 255)
    private String resultFile;

    @Builder
    private Dataset(String key, String parentKey, String type, String owner,
                    Map<String, Object> parameters, Instant createdAt, String resultFile) {
        this.key = key;
        this.parentKey = parentKey;
        this.type = type;
        this.owner = owner;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.resultFile = resultFile;
        this.status = "";
        replaceParameters(parameters == null ? Map.of() : parameters);
    }

    public boolean isTopLevel() {
        return parentKey == null || parentKey.isEmpty();
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public void replaceParameters(Map<String, Object> params) {
        this.parameters = new LinkedHashMap<>(params);
        syncDerivedColumns();
    }

    public void putParameter(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        replaceParameters(copy);
    }

    /** @return 실제로 지워졌으면 true */
    public boolean removeParameter(String name) {
        if (!parameters.containsKey(name)) return false;
        Map<String, Object> copy = new LinkedHashMap<>(parameters);
        copy.remove(name);
        replaceParameters(copy);
        return true;
    }

    public void updateStatus(String status) {
        this.status = status;
    }

    public void finish(int numRows) {
        this.numRows = numRows;
        this.finished = true;
    }

    public void assignResultFile(String resultFile) {
        this.resultFile = resultFile;
    }

    private void syncDerivedColumns() {
        Object ds = parameters.get(PARAM_DATASOURCE);
        this.datasource = ds == null ? null : ds.toString();
        this.keep = parameters.get(PARAM_KEEP) != null;
        this.expiresAfter = parseEpochSeconds(parameters.get(PARAM_EXPIRES_AFTER));
    }

    private static Instant parseEpochSeconds(Object value) {
        if (value == null) return null;
        try {
            long seconds;
            if (value instanceof Number n) {
                seconds = n.longValue();
            } else {
                String s = value.toString().trim();
                if (!s.matches("\\d+")) return null;
                seconds = Long.parseLong(s);
            }
            // 컬럼에 담을 수 없는 범위는 만료 없음으로 본다
            if (seconds > MAX_EPOCH_SECONDS) return null;
            return Instant.ofEpochSecond(seconds);
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }
}
