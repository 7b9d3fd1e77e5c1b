package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.SelectionRequest;
import com.chambua.schoolsports.dto.StudentSelectionDTO;
import com.chambua.schoolsports.model.StudentSelection;
import com.chambua.schoolsports.service.StudentSelectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/student-selections")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class StudentSelectionController {

    private final StudentSelectionService selectionService;

    public StudentSelectionController(StudentSelectionService selectionService) {
        this.selectionService = selectionService;
    }

    @GetMapping
    public List<StudentSelectionDTO> list(@RequestParam(value = "managerId", required = false) Long managerId) {
        return selectionService.listForManager(managerId);
    }

    @PostMapping("/toggle")
    public ResponseEntity<?> toggle(@RequestBody SelectionRequest request) {
        boolean selected = selectionService.toggle(request);
        String message = "Student " + (selected ? "selected" : "deselected") + " successfully";
        return ResponseEntity.ok(Map.of("success", true, "message", message));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody SelectionRequest request) {
        StudentSelection created = selectionService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "selection", created));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        selectionService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Selection deleted successfully"));
    }
}
