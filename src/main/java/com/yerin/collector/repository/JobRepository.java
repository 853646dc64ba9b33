package com.yerin.collector.repository;

import com.yerin.collector.domain.Job;
import com.yerin.collector.domain.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByDedupKey(String dedupKey);

    boolean existsByDedupKey(String dedupKey);

    long countByTypeAndStatusIn(String type, Collection<JobStatus> statuses);

    boolean existsByTypeAndRemoteIdAndStatusIn(String type, String remoteId, Collection<JobStatus> statuses);

    long countByStatus(JobStatus status);

    List<Job> findByTypeAndStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
            String type, JobStatus status, Instant now, Pageable pageable);

    List<Job> findTop100ByStatusInAndHeartbeatAtLessThanOrderByHeartbeatAtAsc(
            Collection<JobStatus> statuses, Instant heartbeatBefore);

    @Query("select j.type, j.status, count(j) from Job j group by j.type, j.status")
    List<Object[]> countGroupedByTypeAndStatus();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.collector.domain.JobStatus.CLAIMED,
              j.dedupKey = null,
              j.attempts = j.attempts + 1,
              j.claimedAt = :now,
              j.claimedBy = :workerId,
              j.heartbeatAt = :now,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.collector.domain.JobStatus.QUEUED
       """)
    int claimIfQueued(@Param("id") Long id,
                      @Param("workerId") String workerId,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.collector.domain.JobStatus.RUNNING,
              j.heartbeatAt = :now,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.collector.domain.JobStatus.CLAIMED
       """)
    int markRunningIfClaimed(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.heartbeatAt = :now
        where j.id = :id
          and j.claimedBy = :workerId
          and j.status in (com.yerin.collector.domain.JobStatus.CLAIMED, com.yerin.collector.domain.JobStatus.RUNNING)
       """)
    int touchHeartbeat(@Param("id") Long id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.collector.domain.JobStatus.QUEUED,
              j.dedupKey = :dedupKey,
              j.nextAttemptAt = :nextAttemptAt,
              j.claimedAt = null,
              j.claimedBy = null,
              j.heartbeatAt = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status in (com.yerin.collector.domain.JobStatus.CLAIMED, com.yerin.collector.domain.JobStatus.RUNNING)
       """)
    int requeueIfActive(@Param("id") Long id,
                        @Param("dedupKey") String dedupKey,
                        @Param("nextAttemptAt") Instant nextAttemptAt,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.collector.domain.JobStatus.QUEUED,
              j.dedupKey = :dedupKey,
              j.nextAttemptAt = :nextAttemptAt,
              j.claimedAt = null,
              j.claimedBy = null,
              j.heartbeatAt = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status in (com.yerin.collector.domain.JobStatus.CLAIMED, com.yerin.collector.domain.JobStatus.RUNNING)
          and j.heartbeatAt < :staleBefore
       """)
    int requeueIfStale(@Param("id") Long id,
                       @Param("dedupKey") String dedupKey,
                       @Param("nextAttemptAt") Instant nextAttemptAt,
                       @Param("staleBefore") Instant staleBefore,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Job j where j.id = :id")
    int deleteJob(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       delete from Job j
        where j.remoteId in :remoteIds
          and j.status = com.yerin.collector.domain.JobStatus.QUEUED
       """)
    int deleteQueuedByRemoteIdIn(@Param("remoteIds") Collection<String> remoteIds);
}
