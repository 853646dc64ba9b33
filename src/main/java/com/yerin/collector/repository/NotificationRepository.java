package com.yerin.collector.repository;

import com.yerin.collector.domain.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    boolean existsByRecipientAndMessage(String recipient, String message);

    List<Notification> findByRecipientOrderByIdAsc(String recipient);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Notification n where n.expiresAt is not null and n.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Notification n where n.recipient = :recipient and n.message like :prefix%")
    int deleteByRecipientAndMessagePrefix(@Param("recipient") String recipient, @Param("prefix") String prefix);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Notification n where n.recipient = :recipient")
    int deleteByRecipient(@Param("recipient") String recipient);
}
