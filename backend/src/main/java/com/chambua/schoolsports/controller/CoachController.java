package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.CoachRequest;
import com.chambua.schoolsports.model.Coach;
import com.chambua.schoolsports.service.CoachService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/coaches")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class CoachController {

    private final CoachService coachService;

    public CoachController(CoachService coachService) {
        this.coachService = coachService;
    }

    @GetMapping
    public List<Coach> list(@RequestParam(value = "managerId", required = false) Long managerId) {
        return coachService.list(managerId);
    }

    @GetMapping("/{id}")
    public Coach get(@PathVariable Long id) {
        return coachService.get(id);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CoachRequest request) {
        Coach created = coachService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "coach", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody CoachRequest request) {
        return ResponseEntity.ok(Map.of("success", true, "coach", coachService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        coachService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Coach deleted successfully"));
    }
}
