package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.StudentLink;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StudentLinkRepository extends JpaRepository<StudentLink, Long> {
    List<StudentLink> findAllByOrderByCreatedAtDescIdDesc();
    List<StudentLink> findByManagerIdOrderByCreatedAtDescIdDesc(Long managerId);
    Optional<StudentLink> findByToken(String token);
    boolean existsByToken(String token);
}
