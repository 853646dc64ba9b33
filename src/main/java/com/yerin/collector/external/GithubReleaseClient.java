package com.yerin.collector.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.Optional;

/**
 * GitHub releases API. 저장소가 없거나 비공개면 empty, 그 밖의 통신/파싱 실패는 RestClientException.
 */
@Slf4j
@Component
public class GithubReleaseClient {

    private final RestClient restClient;

    public GithubReleaseClient(RestClient.Builder builder,
                               @Value("${collector.github.api-url:https://api.github.com}") String apiUrl,
                               @Value("${collector.github.timeout:5s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        this.restClient = builder
                .baseUrl(apiUrl)
                .requestFactory(requestFactory)
                .defaultHeader("Accept", "application/vnd.github+json")
                .build();
    }

    /**
     * @param repositoryId owner/repo
     */
    public Optional<LatestRelease> latestRelease(String repositoryId) throws RestClientException {
        if (!repositoryId.contains("/")) {
            throw new IllegalArgumentException("repository id must be owner/repo: " + repositoryId);
        }
        try {
            LatestRelease release = restClient.get()
                    .uri("/repos/{owner}/{repo}/releases/latest", (Object[]) repositoryId.split("/", 2))
                    .retrieve()
                    .body(LatestRelease.class);
            if (release == null || release.tagName() == null) {
                throw new RestClientException("release response without tag_name for " + repositoryId);
            }
            return Optional.of(release);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("[GitHub] no release found for {}", repositoryId);
            return Optional.empty();
        }
    }
}
