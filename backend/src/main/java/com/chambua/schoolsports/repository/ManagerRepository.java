package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.Manager;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ManagerRepository extends JpaRepository<Manager, Long> {
    List<Manager> findAllByOrderByCreatedAtDescIdDesc();
    List<Manager> findByTeamIdOrderByCreatedAtDescIdDesc(Long teamId);
    Optional<Manager> findByEmail(String email);
    Optional<Manager> findFirstByEmailAndContact(String email, String contact);
    boolean existsByEmail(String email);
    boolean existsByEmailAndIdNot(String email, Long id);

    // Sport is referenced by name, not by key
    long countBySport(String sport);
}
