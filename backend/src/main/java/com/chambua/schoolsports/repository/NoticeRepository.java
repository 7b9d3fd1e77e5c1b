package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.Notice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NoticeRepository extends JpaRepository<Notice, Long> {
    List<Notice> findAllByOrderByNoticeDateDescCreatedAtDescIdDesc();
}
