package com.yerin.collector.repository;

import com.yerin.collector.domain.Dataset;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DatasetRepository extends JpaRepository<Dataset, String> {

    /** 자식 생성과 하위 트리 삭제가 같은 부모 행에서 줄을 선다. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Dataset d where d.key = :key")
    Optional<Dataset> lockByKey(@Param("key") String key);

    @Query("select d.key from Dataset d where d.parentKey = :parentKey")
    List<String> findKeysByParentKey(@Param("parentKey") String parentKey);

    @Query("select d.key from Dataset d where d.owner = :owner")
    List<String> findKeysByOwner(@Param("owner") String owner);

    @Query("""
       select d.key from Dataset d
        where (d.parentKey is null or d.parentKey = '')
          and d.datasource = :datasource
          and d.createdAt < :cutoff
          and d.keep = false
       """)
    List<String> findExpiredTopLevelKeys(@Param("datasource") String datasource, @Param("cutoff") Instant cutoff);

    @Query("select d.key from Dataset d where d.expiresAfter is not null and d.expiresAfter < :now")
    List<String> findKeysExpiredBefore(@Param("now") Instant now);

    @Query("select d.resultFile from Dataset d where d.key in :keys and d.resultFile is not null")
    List<String> findResultFilesByKeyIn(@Param("keys") Collection<String> keys);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Dataset d where d.key in :keys")
    int deleteByKeyIn(@Param("keys") Collection<String> keys);
}
