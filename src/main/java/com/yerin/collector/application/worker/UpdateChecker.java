package com.yerin.collector.application.worker;

import com.yerin.collector.application.BasicWorker;
import com.yerin.collector.application.EnsureJob;
import com.yerin.collector.application.WorkerJob;
import com.yerin.collector.config.CollectorProperties;
import com.yerin.collector.domain.Notification;
import com.yerin.collector.external.GithubReleaseClient;
import com.yerin.collector.external.LatestRelease;
import com.yerin.collector.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 설정된 GitHub 저장소의 최신 릴리스가 현재 버전(.current-version)보다 새로우면
 * 관리자 알림을 남긴다. 버전이 따라잡으면 그 알림을 지운다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateChecker extends BasicWorker {

    public static final String TYPE = "check-for-updates";
    static final String NOTICE_PREFIX = "A new version of collector";
    static final String VERSION_FILE = ".current-version";

    // 3시간마다
    private static final long INTERVAL_SECONDS = 10800;

    private final CollectorProperties properties;
    private final GithubReleaseClient github;
    private final NotificationService notificationService;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<EnsureJob> ensureJob() {
        String url = properties.getGithubUrl();
        return Optional.of(new EnsureJob(url == null || url.isBlank() ? "localhost" : url, INTERVAL_SECONDS));
    }

    @Override
    protected void work(WorkerJob job) {
        Path versionFile = Path.of(properties.getPathRoot(), VERSION_FILE);
        String repoUrl = properties.getGithubUrl();
        if (!Files.exists(versionFile) || repoUrl == null || repoUrl.isBlank()) {
            return;
        }

        String repoId = repositoryId(repoUrl);
        String currentVersion;
        try (BufferedReader in = Files.newBufferedReader(versionFile, StandardCharsets.UTF_8)) {
            String line = in.readLine();
            currentVersion = line == null ? "" : line.strip();
        } catch (IOException e) {
            log.warn("[Worker.{}] cannot read {}: {}", TYPE, versionFile, e.toString());
            return;
        }

        try {
            Optional<LatestRelease> latest = github.latestRelease(repoId);
            if (latest.isEmpty()) {
                log.warn("'collector.github-url' may be misconfigured - repository does not exist or is private");
                return;
            }

            String latestTag = latest.get().tagName().replaceFirst("^v", "");
            if (ReleaseVersion.parse(latestTag).compareTo(ReleaseVersion.parse(currentVersion)) > 0) {
                // 일반 사용자는 업데이트할 수 없으니 관리자에게만
                notificationService.add(Notification.ADMINS, noticeMessage(latest.get().htmlUrl(), latestTag, currentVersion), true);
            } else {
                int removed = notificationService.removeByPrefix(Notification.ADMINS, NOTICE_PREFIX);
                if (removed > 0) log.info("[Worker.{}] up to date ({}), removed {} notice(s)", TYPE, currentVersion, removed);
            }
        } catch (RestClientException | IllegalArgumentException e) {
            // GitHub 쪽 문제이거나 응답이 이상하다. 다음 주기에 다시 본다.
            log.debug("[Worker.{}] update check failed: {}", TYPE, e.toString());
        }
    }

    static String repositoryId(String repoUrl) {
        String url = repoUrl.endsWith("/") ? repoUrl : repoUrl + "/";
        return url.replaceFirst("^https?://(www\\.)?github\\.com/", "").replaceFirst("/$", "");
    }

    static String noticeMessage(String releaseUrl, String latest, String current) {
        return NOTICE_PREFIX + " is [available](" + releaseUrl + "). The latest version is " + latest
                + "; you are running version " + current + ".";
    }
}
