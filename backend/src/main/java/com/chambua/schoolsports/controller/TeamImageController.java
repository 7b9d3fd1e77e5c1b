package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.dto.TeamImage;
import com.chambua.schoolsports.service.TeamImageService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/team-images")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class TeamImageController {

    private final TeamImageService teamImageService;

    public TeamImageController(TeamImageService teamImageService) {
        this.teamImageService = teamImageService;
    }

    @GetMapping
    public List<TeamImage> list() {
        return teamImageService.list();
    }

    @PostMapping("/upload")
    public ResponseEntity<?> upload(@RequestParam(value = "image", required = false) MultipartFile image,
                                    @RequestParam(value = "teamName", required = false) String teamName,
                                    @RequestParam(value = "sport", required = false) String sport) {
        TeamImage created = teamImageService.upload(image, teamName, sport);
        return ResponseEntity.ok(Map.of("success", true, "image", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable String id,
                                    @RequestParam(value = "image", required = false) MultipartFile image,
                                    @RequestParam(value = "teamName", required = false) String teamName,
                                    @RequestParam(value = "sport", required = false) String sport,
                                    @RequestParam(value = "imageUrl", required = false) String imageUrl) {
        TeamImage updated = teamImageService.update(id, image, teamName, sport, imageUrl);
        return ResponseEntity.ok(Map.of("success", true, "image", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        teamImageService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Image deleted successfully"));
    }
}
