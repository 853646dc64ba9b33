package com.yerin.collector.repository;

import com.yerin.collector.domain.Annotation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface AnnotationRepository extends JpaRepository<Annotation, Long> {

    List<Annotation> findByDatasetKeyOrderByIdAsc(String datasetKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Annotation a where a.datasetKey = :datasetKey and a.label in :labels")
    int deleteByDatasetKeyAndLabelIn(@Param("datasetKey") String datasetKey, @Param("labels") Collection<String> labels);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Annotation a where a.datasetKey in :keys")
    int deleteByDatasetKeyIn(@Param("keys") Collection<String> keys);
}
