package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.Student;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StudentRepository extends JpaRepository<Student, Long> {
    List<Student> findAllByOrderByCreatedAtDescIdDesc();
    List<Student> findByManagerIdOrderByCreatedAtDescIdDesc(Long managerId);
    Optional<Student> findByPrnUid(String prnUid);
    boolean existsByPrnUid(String prnUid);
    boolean existsByPrnUidAndIdNot(String prnUid, Long id);
}
