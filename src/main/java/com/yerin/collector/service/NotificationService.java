package com.yerin.collector.service;

import com.yerin.collector.domain.Notification;
import com.yerin.collector.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;

    /**
     * 같은 수신자에게 같은 문구의 알림이 이미 있으면 아무것도 하지 않는다.
     * @return 새로 만들었으면 true
     */
    @Transactional
    public boolean add(String recipient, String message, boolean dismissible, Instant expiresAt) {
        if (notificationRepository.existsByRecipientAndMessage(recipient, message)) {
            return false;
        }
        notificationRepository.save(Notification.builder()
                .recipient(recipient)
                .message(message)
                .dismissible(dismissible)
                .expiresAt(expiresAt)
                .build());
        log.info("[Notification] added recipient={}, dismissible={}, expiresAt={}", recipient, dismissible, expiresAt);
        return true;
    }

    @Transactional
    public boolean add(String recipient, String message, boolean dismissible) {
        return add(recipient, message, dismissible, null);
    }

    @Transactional
    public int removeByPrefix(String recipient, String prefix) {
        return notificationRepository.deleteByRecipientAndMessagePrefix(recipient, prefix);
    }

    @Transactional
    public int removeForRecipient(String recipient) {
        return notificationRepository.deleteByRecipient(recipient);
    }

    @Transactional
    public int deleteExpired() {
        return notificationRepository.deleteExpired(Instant.now());
    }

    @Transactional(readOnly = true)
    public List<Notification> forRecipient(String recipient) {
        return notificationRepository.findByRecipientOrderByIdAsc(recipient);
    }
}
