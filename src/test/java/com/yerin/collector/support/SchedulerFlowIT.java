package com.yerin.collector.support;

import com.yerin.collector.application.worker.ExpirationWorker;
import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.repository.JobRepository;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestHandlersConfig.class)
@ActiveProfiles("test")
@DisplayName("E2E: 관리자 등록 → 스케줄러 실행 → 완료")
class SchedulerFlowIT extends IntegrationTestBase {

    @Autowired
    TestRestTemplate rest;

    @Autowired
    JobRepository jobRepository;

    private HttpEntity<Void> admin() {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Admin-Token", "test-admin-token");
        return new HttpEntity<>(h);
    }

    @Test
    @DisplayName("일회성 작업은 실행 후 큐에서 사라진다")
    void one_shot_flow() {
        ResponseEntity<Map> created = rest.exchange(
                "/admin/jobs/{type}?remoteId={id}", HttpMethod.POST, admin(), Map.class,
                TestHandlersConfig.TYPE, "it-" + System.currentTimeMillis());
        assertThat(created.getStatusCode().is2xxSuccessful()).isTrue();
        Map<?, ?> data = (Map<?, ?>) created.getBody().get("data");
        String remoteId = String.valueOf(data.get("remoteId"));

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> {
                    assertThat(TestHandlersConfig.SEEN).contains(remoteId);
                    assertThat(jobRepository.findAll())
                            .noneMatch(j -> j.getRemoteId().equals(remoteId));
                });
    }

    @Test
    @DisplayName("실패한 반복 작업도 다시 대기열로 돌아간다")
    void failing_recurring_job_is_rescheduled() {
        String remoteId = "fail-" + System.currentTimeMillis();
        rest.exchange("/admin/jobs/{type}?remoteId={id}&interval=3600", HttpMethod.POST, admin(), Map.class,
                TestHandlersConfig.TYPE, remoteId);

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> assertThat(jobRepository.findAll())
                        .filteredOn(j -> j.getRemoteId().equals(remoteId))
                        .singleElement()
                        .satisfies(j -> {
                            assertThat(j.getStatus()).isEqualTo(JobStatus.QUEUED);
                            assertThat(j.getAttempts()).isEqualTo(1);
                        }));
    }

    @Test
    @DisplayName("만료 워커의 ensure 작업이 시작 시 심어진다")
    void ensure_job_seeded() {
        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertThat(jobRepository.findAll())
                        .anyMatch(j -> j.getType().equals(ExpirationWorker.TYPE)));
    }

    @Test
    @DisplayName("관리자 메트릭: 헤더 없으면 401, 있으면 상태별 개수")
    void metrics_endpoint() {
        ResponseEntity<String> blocked = rest.getForEntity("/admin/metrics/jobs", String.class);
        ResponseEntity<String> ok = rest.exchange("/admin/metrics/jobs", HttpMethod.GET, admin(), String.class);

        assertThat(blocked.getStatusCode().value()).isEqualTo(401);
        assertThat(ok.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(ok.getBody()).contains("QUEUED").contains("CLAIMED").contains("RUNNING");
    }
}
