package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.StudentSelection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StudentSelectionRepository extends JpaRepository<StudentSelection, Long> {
    Optional<StudentSelection> findByStudentIdAndManagerId(Long studentId, Long managerId);
    boolean existsByStudentIdAndManagerId(Long studentId, Long managerId);
}
