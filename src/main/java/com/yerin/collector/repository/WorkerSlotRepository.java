package com.yerin.collector.repository;

import com.yerin.collector.domain.WorkerSlot;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface WorkerSlotRepository extends JpaRepository<WorkerSlot, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from WorkerSlot s where s.type = :type")
    Optional<WorkerSlot> lockByType(@Param("type") String type);
}
