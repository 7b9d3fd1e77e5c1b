package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.StudentRequest;
import com.chambua.schoolsports.dto.StudentWithSelectionDTO;
import com.chambua.schoolsports.model.Student;
import com.chambua.schoolsports.service.StudentSelectionService;
import com.chambua.schoolsports.service.StudentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class StudentController {

    private final StudentService studentService;
    private final StudentSelectionService selectionService;

    public StudentController(StudentService studentService, StudentSelectionService selectionService) {
        this.studentService = studentService;
        this.selectionService = selectionService;
    }

    @GetMapping("/students")
    public List<Student> list(@RequestParam(value = "managerId", required = false) Long managerId) {
        return studentService.list(managerId);
    }

    @GetMapping("/students/{id}")
    public Student get(@PathVariable Long id) {
        return studentService.get(id);
    }

    @GetMapping("/students/prn/{prnUid}")
    public Student getByPrn(@PathVariable String prnUid) {
        return studentService.getByPrn(prnUid);
    }

    @PostMapping("/students")
    public ResponseEntity<?> create(@RequestBody StudentRequest request) {
        Student created = studentService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "student", created));
    }

    @PutMapping("/students/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody StudentRequest request) {
        return ResponseEntity.ok(Map.of("success", true, "student", studentService.update(id, request)));
    }

    @DeleteMapping("/students/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        studentService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Student deleted successfully"));
    }

    @GetMapping("/students-with-selections")
    public List<StudentWithSelectionDTO> withSelections(@RequestParam(value = "managerId", required = false) Long managerId) {
        return selectionService.studentsWithSelections(managerId);
    }
}
