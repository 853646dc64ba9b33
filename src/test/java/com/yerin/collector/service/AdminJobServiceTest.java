package com.yerin.collector.service;

import com.yerin.collector.application.JobHandler;
import com.yerin.collector.application.JobHandlerRegistry;
import com.yerin.collector.application.WorkerJob;
import com.yerin.collector.domain.JobQueuePort;
import com.yerin.collector.domain.JobRef;
import com.yerin.collector.domain.JobStatus;
import com.yerin.collector.global.exception.AppException;
import com.yerin.collector.global.exception.code.JobErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("관리자 작업 서비스 테스트")
class AdminJobServiceTest {

    JobQueuePort queue = mock(JobQueuePort.class);
    JobHandlerRegistry registry = new JobHandlerRegistry(List.of(new JobHandler() {
        @Override public String type() { return "scrape"; }
        @Override public void handle(WorkerJob job) { }
    }));
    AdminJobService sut = new AdminJobService(queue, registry);

    @Test
    @DisplayName("등록된 타입이면 큐에 넣는다")
    void enqueue_known_type() {
        when(queue.enqueueIfAbsent("scrape", "board", 60)).thenReturn(new JobRef(1L, "scrape", "board", true));

        JobRef ref = sut.enqueue("scrape", "board", 60);

        assertThat(ref.created()).isTrue();
    }

    @Test
    @DisplayName("등록되지 않은 타입은 UNKNOWN_JOB_TYPE")
    void enqueue_unknown_type() {
        assertThatThrownBy(() -> sut.enqueue("nope", "x", 0))
                .isInstanceOf(AppException.class)
                .extracting("errorCode").isEqualTo(JobErrorCode.UNKNOWN_JOB_TYPE);
        verify(queue, never()).enqueueIfAbsent(anyString(), anyString(), anyLong());
    }

    @Test
    @DisplayName("음수 주기는 INVALID_INTERVAL")
    void enqueue_negative_interval() {
        assertThatThrownBy(() -> sut.enqueue("scrape", "x", -1))
                .isInstanceOf(AppException.class)
                .extracting("errorCode").isEqualTo(JobErrorCode.INVALID_INTERVAL);
    }

    @Test
    @DisplayName("상태별 합계는 모든 상태를 0 으로 채운다")
    void totals_fill_all_statuses() {
        Map<JobStatus, Long> scrape = new EnumMap<>(JobStatus.class);
        scrape.put(JobStatus.QUEUED, 3L);
        Map<JobStatus, Long> expire = new EnumMap<>(JobStatus.class);
        expire.put(JobStatus.QUEUED, 1L);
        expire.put(JobStatus.RUNNING, 1L);
        when(queue.countsByTypeAndStatus()).thenReturn(Map.of("scrape", scrape, "expire", expire));

        assertThat(sut.totals())
                .containsEntry(JobStatus.QUEUED, 4L)
                .containsEntry(JobStatus.CLAIMED, 0L)
                .containsEntry(JobStatus.RUNNING, 1L);
    }
}
