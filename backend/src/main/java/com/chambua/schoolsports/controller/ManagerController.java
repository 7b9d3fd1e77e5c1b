package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.LoginRequest;
import com.chambua.schoolsports.dto.ManagerRequest;
import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.service.ManagerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/managers")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class ManagerController {

    private final ManagerService managerService;

    public ManagerController(ManagerService managerService) {
        this.managerService = managerService;
    }

    @GetMapping
    public List<Manager> list(@RequestParam(value = "teamId", required = false) Long teamId) {
        return managerService.list(teamId);
    }

    @GetMapping("/count")
    public Map<String, Long> count() {
        return Map.of("count", managerService.count());
    }

    @GetMapping("/{id}")
    public Manager get(@PathVariable Long id) {
        return managerService.get(id);
    }

    @GetMapping("/email/{email}")
    public Manager getByEmail(@PathVariable String email) {
        return managerService.getByEmail(email);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody ManagerRequest request) {
        Manager created = managerService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "manager", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody ManagerRequest request) {
        return ResponseEntity.ok(Map.of("success", true, "manager", managerService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        managerService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Manager deleted successfully"));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody LoginRequest request) {
        Manager manager = managerService.login(request.email(), request.contact());
        return ResponseEntity.ok(Map.of("success", true, "manager", manager));
    }
}
