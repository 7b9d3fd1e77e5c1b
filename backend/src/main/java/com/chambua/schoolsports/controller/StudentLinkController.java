package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.LinkStatusRequest;
import com.chambua.schoolsports.dto.PublicLinkDTO;
import com.chambua.schoolsports.dto.StudentLinkRequest;
import com.chambua.schoolsports.dto.StudentLinkSubmission;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.model.StudentLink;
import com.chambua.schoolsports.service.StudentLinkService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/student-links")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class StudentLinkController {

    private final StudentLinkService linkService;

    public StudentLinkController(StudentLinkService linkService) {
        this.linkService = linkService;
    }

    @GetMapping
    public List<StudentLink> list(@RequestParam(value = "managerId", required = false) Long managerId) {
        return linkService.list(managerId);
    }

    @PostMapping
    public ResponseEntity<?> issue(@RequestBody StudentLinkRequest request) {
        StudentLink link = linkService.issue(request.managerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "link", link));
    }

    // Public: no manager login behind this one
    @GetMapping("/token/{token}")
    public PublicLinkDTO resolve(@PathVariable String token) {
        return linkService.resolve(token);
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<?> setStatus(@PathVariable Long id, @RequestBody LinkStatusRequest request) {
        StudentLink link = linkService.setActive(id, request.isActive());
        return ResponseEntity.ok(Map.of("success", true, "link", link));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        linkService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Link deleted successfully"));
    }

    @PostMapping("/submit")
    public ResponseEntity<?> submit(@RequestBody StudentLinkSubmission submission) {
        Student student = linkService.submit(submission);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "student", student));
    }
}
