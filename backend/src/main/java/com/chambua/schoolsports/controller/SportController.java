package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.SportRequest;
import com.chambua.schoolsports.model.Sport;
import com.chambua.schoolsports.service.SportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sports")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class SportController {

    private final SportService sportService;

    public SportController(SportService sportService) {
        this.sportService = sportService;
    }

    @GetMapping("/test")
    public Map<String, String> test() {
        return Map.of("message", "Sports API is working");
    }

    @GetMapping
    public List<Sport> list() {
        return sportService.list();
    }

    @GetMapping("/{id}")
    public Sport get(@PathVariable Long id) {
        return sportService.get(id);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody SportRequest request) {
        Sport created = sportService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "sport", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody SportRequest request) {
        return ResponseEntity.ok(Map.of("success", true, "sport", sportService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        sportService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Sport deleted successfully"));
    }
}
