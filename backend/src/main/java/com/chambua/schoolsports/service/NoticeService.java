package com.chambua.schoolsports.service;

import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.Notice;
import com.chambua.schoolsports.repository.NoticeRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class NoticeService {
    private static final Logger log = LoggerFactory.getLogger(NoticeService.class);

    private final NoticeRepository noticeRepository;
    private final FileStorageService storage;
    private final Clock clock;

    public NoticeService(NoticeRepository noticeRepository, FileStorageService storage, Clock clock) {
        this.noticeRepository = noticeRepository;
        this.storage = storage;
        this.clock = clock;
    }

    public List<Notice> list() {
        return noticeRepository.findAllByOrderByNoticeDateDescCreatedAtDescIdDesc();
    }

    public Notice get(Long id) {
        return noticeRepository.findById(id).orElseThrow(() -> new NotFoundException("Notice not found"));
    }

    @Transactional
    public Notice create(String title, String description, String noticeDate,
                         MultipartFile document, MultipartFile scheduleImage) {
        requireFields(title, description);
        Notice n = new Notice();
        n.setTitle(title.trim());
        n.setDescription(description.trim());
        n.setNoticeDate(parseNoticeDate(noticeDate, LocalDate.now(clock)));
        if (FileStorageService.hasContent(document)) {
            n.setDocumentUrl(storage.store(document, UploadKind.NOTICE_DOCUMENT).url());
        }
        if (FileStorageService.hasContent(scheduleImage)) {
            n.setScheduleImageUrl(storage.store(scheduleImage, UploadKind.NOTICE_SCHEDULE).url());
        }
        Notice saved = noticeRepository.saveAndFlush(n);
        log.info("Published notice {} '{}'", saved.getId(), saved.getTitle());
        return saved;
    }

    /**
     * New files replace the current ones; a remove flag without a new file clears the attachment.
     * Replaced files are deleted after commit.
     */
    @Transactional
    public Notice update(Long id, String title, String description, String noticeDate,
                         MultipartFile document, MultipartFile scheduleImage,
                         boolean removeDocument, boolean removeScheduleImage) {
        requireFields(title, description);
        Notice n = get(id);
        n.setTitle(title.trim());
        n.setDescription(description.trim());
        n.setNoticeDate(parseNoticeDate(noticeDate, n.getNoticeDate()));

        String previousDocument = n.getDocumentUrl();
        if (FileStorageService.hasContent(document)) {
            n.setDocumentUrl(storage.store(document, UploadKind.NOTICE_DOCUMENT).url());
            storage.deleteAfterCommit(previousDocument);
        } else if (removeDocument) {
            n.setDocumentUrl(null);
            storage.deleteAfterCommit(previousDocument);
        }

        String previousSchedule = n.getScheduleImageUrl();
        if (FileStorageService.hasContent(scheduleImage)) {
            n.setScheduleImageUrl(storage.store(scheduleImage, UploadKind.NOTICE_SCHEDULE).url());
            storage.deleteAfterCommit(previousSchedule);
        } else if (removeScheduleImage) {
            n.setScheduleImageUrl(null);
            storage.deleteAfterCommit(previousSchedule);
        }
        return noticeRepository.saveAndFlush(n);
    }

    @Transactional
    public void delete(Long id) {
        Notice n = get(id);
        noticeRepository.delete(n);
        noticeRepository.flush();
        storage.deleteAfterCommit(n.getDocumentUrl());
        storage.deleteAfterCommit(n.getScheduleImageUrl());
        log.info("Deleted notice {}", id);
    }

    private static void requireFields(String title, String description) {
        if (FieldNormalizer.anyBlank(title, description)) {
            throw new BadRequestException("Title and description are required");
        }
    }

    private static LocalDate parseNoticeDate(String raw, LocalDate fallback) {
        if (FieldNormalizer.isBlank(raw)) return fallback;
        LocalDate date = FieldNormalizer.parseDate(raw);
        if (date == null) throw new BadRequestException("Invalid notice date");
        return date;
    }
}
