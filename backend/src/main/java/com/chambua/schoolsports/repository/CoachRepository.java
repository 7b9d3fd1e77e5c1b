package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.Coach;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CoachRepository extends JpaRepository<Coach, Long> {
    List<Coach> findAllByOrderByCreatedAtDescIdDesc();
    List<Coach> findByManagerIdOrderByCreatedAtDescIdDesc(Long managerId);
}
