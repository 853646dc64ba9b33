package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_dedup", columnNames = "dedup_key"),
        indexes = {
                @Index(name = "ix_job_type_status", columnList = "type, status"),
                @Index(name = "ix_job_remote_id", columnList = "remote_id")
        })
@DynamicUpdate
public class Job {

    /** 미점유 상태에서만 채워지는 dedup 키의 구분자 */
    private static final String DEDUP_SEPARATOR = "|";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String type;

    @Column(name = "remote_id", nullable = false, length = 512)
    private String remoteId;

    @Column(name = "dedup_key", length = 640)
    private String dedupKey;

    @Column(name = "interval_seconds", nullable = false)
    private long intervalSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claimed_by", length = 200)
    private String claimedBy;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static String dedupKey(String type, String remoteId) {
        return type + DEDUP_SEPARATOR + remoteId;
    }

    public boolean isRecurring() {
        return intervalSeconds > 0;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = JobStatus.QUEUED;
        if (nextAttemptAt == null) nextAttemptAt = now;
        if (status == JobStatus.QUEUED && dedupKey == null) dedupKey = dedupKey(type, remoteId);
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
