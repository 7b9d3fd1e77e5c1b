package com.chambua.schoolsports.repository;

import com.chambua.schoolsports.model.EventImage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventImageRepository extends JpaRepository<EventImage, Long> {
    List<EventImage> findAllByOrderByDisplayOrderAscCreatedAtDescIdDesc();
}
