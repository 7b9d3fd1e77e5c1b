package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.Manager;
import com.chambua.schoolsports.model.Team;
import com.chambua.schoolsports.service.TeamService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/teams")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class TeamController {

    private final TeamService teamService;

    public TeamController(TeamService teamService) {
        this.teamService = teamService;
    }

    @GetMapping
    public List<Team> list() {
        return teamService.list();
    }

    @GetMapping("/{id}")
    public Team get(@PathVariable Long id) {
        return teamService.get(id);
    }

    @GetMapping("/{id}/managers")
    public List<Manager> managers(@PathVariable Long id) {
        return teamService.managersOf(id);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestParam(value = "name", required = false) String name,
                                    @RequestParam(value = "department", required = false) String department,
                                    @RequestParam(value = "color", required = false) String color,
                                    @RequestParam(value = "logo", required = false) MultipartFile logo) {
        Team created = teamService.create(name, department, color, logo);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "team", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id,
                                    @RequestParam(value = "name", required = false) String name,
                                    @RequestParam(value = "department", required = false) String department,
                                    @RequestParam(value = "color", required = false) String color,
                                    @RequestParam(value = "removeLogo", required = false, defaultValue = "false") boolean removeLogo,
                                    @RequestParam(value = "logo", required = false) MultipartFile logo) {
        Team updated = teamService.update(id, name, department, color, logo, removeLogo);
        return ResponseEntity.ok(Map.of("success", true, "team", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        teamService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Team deleted successfully"));
    }
}
