package com.yerin.collector.service;

import com.yerin.collector.domain.Notification;
import com.yerin.collector.repository.NotificationRepository;
import com.yerin.collector.support.PersistenceTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import(PersistenceTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("알림 서비스 테스트")
class NotificationServiceTest {

    @Autowired NotificationService notificationService;
    @Autowired NotificationRepository notificationRepository;

    @BeforeEach
    void setUp() {
        notificationRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("같은 수신자/문구 알림은 한 번만 저장된다")
    void add_is_idempotent() {
        assertThat(notificationService.add("alice", "hello", true)).isTrue();
        assertThat(notificationService.add("alice", "hello", false)).isFalse();
        assertThat(notificationService.add("bob", "hello", true)).isTrue();

        assertThat(notificationService.forRecipient("alice")).hasSize(1)
                .first().extracting(Notification::isDismissible).isEqualTo(true);
    }

    @Test
    @DisplayName("접두사가 같은 알림만 지운다")
    void remove_by_prefix() {
        notificationService.add(Notification.ADMINS, "A new version of collector is available", true);
        notificationService.add(Notification.ADMINS, "Disk almost full", true);
        notificationService.add("alice", "A new version of collector is available", true);

        int removed = notificationService.removeByPrefix(Notification.ADMINS, "A new version of collector");

        assertThat(removed).isEqualTo(1);
        assertThat(notificationService.forRecipient(Notification.ADMINS))
                .extracting(Notification::getMessage).containsExactly("Disk almost full");
        assertThat(notificationService.forRecipient("alice")).hasSize(1);
    }

    @Test
    @DisplayName("만료 시각이 지난 알림만 지운다")
    void delete_expired() {
        notificationService.add("alice", "old", false, Instant.now().minusSeconds(10));
        notificationService.add("alice", "later", false, Instant.now().plusSeconds(3600));
        notificationService.add("alice", "forever", false);

        assertThat(notificationService.deleteExpired()).isEqualTo(1);
        assertThat(notificationService.forRecipient("alice"))
                .extracting(Notification::getMessage).containsExactly("later", "forever");
    }
}
