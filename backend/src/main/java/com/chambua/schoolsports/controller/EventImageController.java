package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.EventImage;
import com.chambua.schoolsports.service.EventImageService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/event-images")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class EventImageController {

    private final EventImageService eventImageService;

    public EventImageController(EventImageService eventImageService) {
        this.eventImageService = eventImageService;
    }

    @GetMapping
    public List<EventImage> list() {
        return eventImageService.list();
    }

    @GetMapping("/{id}")
    public EventImage get(@PathVariable Long id) {
        return eventImageService.get(id);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestParam(value = "image", required = false) MultipartFile image,
                                    @RequestParam(value = "title", required = false) String title,
                                    @RequestParam(value = "description", required = false) String description,
                                    @RequestParam(value = "displayOrder", required = false) String displayOrder) {
        EventImage created = eventImageService.create(image, title, description, displayOrder);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "eventImage", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id,
                                    @RequestParam(value = "image", required = false) MultipartFile image,
                                    @RequestParam(value = "title", required = false) String title,
                                    @RequestParam(value = "description", required = false) String description,
                                    @RequestParam(value = "displayOrder", required = false) String displayOrder) {
        EventImage updated = eventImageService.update(id, image, title, description, displayOrder);
        return ResponseEntity.ok(Map.of("success", true, "eventImage", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        eventImageService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Event image deleted successfully"));
    }
}
