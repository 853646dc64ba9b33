package com.yerin.collector.repository;

import com.yerin.collector.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserRepository extends JpaRepository<User, String> {
    List<User> findByDeleteAfterIsNotNull();
}
