package com.chambua.schoolsports.controller;

import com.chambua.schoolsports.model.Notice;
import com.chambua.schoolsports.service.NoticeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notices")
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class NoticeController {

    private final NoticeService noticeService;

    public NoticeController(NoticeService noticeService) {
        this.noticeService = noticeService;
    }

    @GetMapping
    public List<Notice> list() {
        return noticeService.list();
    }

    @GetMapping("/{id}")
    public Notice get(@PathVariable Long id) {
        return noticeService.get(id);
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestParam(value = "title", required = false) String title,
                                    @RequestParam(value = "description", required = false) String description,
                                    @RequestParam(value = "noticeDate", required = false) String noticeDate,
                                    @RequestParam(value = "document", required = false) MultipartFile document,
                                    @RequestParam(value = "scheduleImage", required = false) MultipartFile scheduleImage) {
        Notice created = noticeService.create(title, description, noticeDate, document, scheduleImage);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "notice", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id,
                                    @RequestParam(value = "title", required = false) String title,
                                    @RequestParam(value = "description", required = false) String description,
                                    @RequestParam(value = "noticeDate", required = false) String noticeDate,
                                    @RequestParam(value = "removeDocument", required = false, defaultValue = "false") boolean removeDocument,
                                    @RequestParam(value = "removeScheduleImage", required = false, defaultValue = "false") boolean removeScheduleImage,
                                    @RequestParam(value = "document", required = false) MultipartFile document,
                                    @RequestParam(value = "scheduleImage", required = false) MultipartFile scheduleImage) {
        Notice updated = noticeService.update(id, title, description, noticeDate, document, scheduleImage,
                removeDocument, removeScheduleImage);
        return ResponseEntity.ok(Map.of("success", true, "notice", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id) {
        noticeService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Notice deleted successfully"));
    }
}
