package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "notification", indexes = {
        @Index(name = "ix_notification_recipient", columnList = "recipient"),
        @Index(name = "ix_notification_expires", columnList = "expires_at")
})
public class Notification {

    /** 모든 관리자에게 보내는 알림의 수신자 */
    public static final String ADMINS = "!admins";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String recipient;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(nullable = false)
    private boolean dismissible;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() { if (createdAt == null) createdAt = Instant.now(); }
}
