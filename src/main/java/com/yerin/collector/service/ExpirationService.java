package com.yerin.collector.service;

import com.yerin.collector.config.CollectorProperties;
import com.yerin.collector.domain.User;
import com.yerin.collector.repository.DatasetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 만료 정책 스윕. 각 스윕은 서로 독립적이고 여러 번 돌려도 결과가 같다.
 * 개별 데이터셋/사용자 처리 실패는 로그만 남기고 다음 대상으로 넘어간다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpirationService {

    static final Duration WARNING_WINDOW = Duration.ofDays(7);

    private static final Pattern CALENDAR_DATE = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}$");
    private static final Pattern UNIX_TIMESTAMP = Pattern.compile("^[0-9]+$");
    private static final DateTimeFormatter WARNING_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final DatasetRepository datasetRepository;
    private final DatasetService datasetService;
    private final UserService userService;
    private final NotificationService notificationService;
    private final CollectorProperties properties;

    /**
     * datasource 보존 기간이 지난 최상위 데이터셋과 expires-after 가 지난 데이터셋을 지운다.
     * @return 지운 데이터셋 수
     */
    public int expireDatasets() {
        Instant now = Instant.now();
        Set<String> keys = new LinkedHashSet<>();

        for (Map.Entry<String, CollectorProperties.Datasource> e : properties.getDatasources().entrySet()) {
            long timeout = e.getValue() == null ? 0 : e.getValue().getTimeout();
            if (timeout <= 0) continue;
            keys.addAll(datasetRepository.findExpiredTopLevelKeys(e.getKey(), now.minusSeconds(timeout)));
        }
        keys.addAll(datasetRepository.findKeysExpiredBefore(now));

        int deleted = 0;
        for (String key : keys) {
            try {
                if (datasetService.delete(key)) {
                    deleted++;
                    log.info("[Expiration] deleted dataset {} (expired per configuration)", key);
                }
            } catch (RuntimeException ex) {
                log.error("[Expiration] failed to delete dataset {}", key, ex);
            }
        }
        return deleted;
    }

    /**
     * delete-after 가 지난 사용자를 지우고, 7일 안에 만료되는 사용자에게 경고를 한 번 남긴다.
     * @return 지운 사용자 수
     */
    public int expireUsers() {
        Instant now = Instant.now();
        int deleted = 0;

        for (User user : userService.findWithDeleteAfter()) {
            String username = user.getName();
            Instant expiresAt;
            try {
                expiresAt = parseDeleteAfter(user.getDeleteAfter());
            } catch (DateTimeException | IllegalArgumentException e) {
                log.warn("[Expiration] user {} has invalid expiration date {}", username, user.getDeleteAfter());
                continue;
            }

            try {
                if (expiresAt.isBefore(now)) {
                    log.info("[Expiration] user {} expired - deleting user and datasets", username);
                    if (userService.delete(username)) deleted++;
                } else if (Duration.between(now, expiresAt).compareTo(WARNING_WINDOW) < 0) {
                    notificationService.add(username, warningMessage(expiresAt), false, expiresAt);
                }
            } catch (RuntimeException ex) {
                log.error("[Expiration] failed to expire user {}", username, ex);
            }
        }
        return deleted;
    }

    public int expireNotifications() {
        int n = notificationService.deleteExpired();
        if (n > 0) log.info("[Expiration] deleted {} expired notification(s)", n);
        return n;
    }

    /**
     * YYYY-MM-DD (시스템 시간대 자정) 또는 unix 초.
     * @throws IllegalArgumentException 둘 다 아니면
     */
    static Instant parseDeleteAfter(String value) {
        String v = value == null ? "" : value.trim();
        if (CALENDAR_DATE.matcher(v).matches()) {
            return LocalDate.parse(v).atStartOfDay(ZoneId.systemDefault()).toInstant();
        }
        if (UNIX_TIMESTAMP.matcher(v).matches()) {
            return Instant.ofEpochSecond(Long.parseLong(v));
        }
        throw new IllegalArgumentException("not a date or unix timestamp: " + value);
    }

    static String warningMessage(Instant expiresAt) {
        ZonedDateTime at = expiresAt.atZone(ZoneId.systemDefault());
        return "WARNING: This account will be deleted at <time datetime=\"" + expiresAt + "\">"
                + WARNING_TIME.format(at) + "</time>. Make sure to back up your data before then.";
    }
}
