package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 작업 타입별 잠금 행. 점유(claim) 트랜잭션은 이 행을 FOR UPDATE 로 잡은 뒤
 * 동시 실행 수를 센다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "worker_slot")
public class WorkerSlot {

    @Id
    @Column(length = 100)
    private String type;

    @Column(name = "max_workers", nullable = false)
    private int maxWorkers;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;
}
