package com.yerin.collector.repository;

import com.yerin.collector.domain.JobEventLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobEventLogRepository extends JpaRepository<JobEventLog, Long> {
    List<JobEventLog> findByJobIdOrderByIdAsc(Long jobId);
}
