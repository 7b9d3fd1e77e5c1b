package com.chambua.schoolsports.service;

import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.EventImage;
import com.chambua.schoolsports.repository.EventImageRepository;
import com.chambua.schoolsports.util.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class EventImageService {
    private static final Logger log = LoggerFactory.getLogger(EventImageService.class);

    private final EventImageRepository eventImageRepository;
    private final FileStorageService storage;

    public EventImageService(EventImageRepository eventImageRepository, FileStorageService storage) {
        this.eventImageRepository = eventImageRepository;
        this.storage = storage;
    }

    public List<EventImage> list() {
        return eventImageRepository.findAllByOrderByDisplayOrderAscCreatedAtDescIdDesc();
    }

    public EventImage get(Long id) {
        return eventImageRepository.findById(id).orElseThrow(() -> new NotFoundException("Event image not found"));
    }

    @Transactional
    public EventImage create(MultipartFile image, String title, String description, String displayOrder) {
        if (!FileStorageService.hasContent(image)) throw new BadRequestException("Image file is required");
        int order = parseDisplayOrder(displayOrder, 0);

        EventImage e = new EventImage();
        e.setTitle(FieldNormalizer.trimToNull(title));
        e.setDescription(FieldNormalizer.trimToNull(description));
        e.setDisplayOrder(order);
        e.setImageUrl(storage.store(image, UploadKind.EVENT_IMAGE).url());
        EventImage saved = eventImageRepository.saveAndFlush(e);
        log.info("Created event image {}", saved.getId());
        return saved;
    }

    /** Fields left out of the form keep their current values; a new image replaces the old file. */
    @Transactional
    public EventImage update(Long id, MultipartFile image, String title, String description, String displayOrder) {
        EventImage e = get(id);
        int order = parseDisplayOrder(displayOrder, e.getDisplayOrder());
        if (title != null) e.setTitle(FieldNormalizer.trimToNull(title));
        if (description != null) e.setDescription(FieldNormalizer.trimToNull(description));
        e.setDisplayOrder(order);
        if (FileStorageService.hasContent(image)) {
            String previous = e.getImageUrl();
            e.setImageUrl(storage.store(image, UploadKind.EVENT_IMAGE).url());
            storage.deleteAfterCommit(previous);
        }
        return eventImageRepository.saveAndFlush(e);
    }

    @Transactional
    public void delete(Long id) {
        EventImage e = get(id);
        eventImageRepository.delete(e);
        eventImageRepository.flush();
        storage.deleteAfterCommit(e.getImageUrl());
        log.info("Deleted event image {}", id);
    }

    private static int parseDisplayOrder(String raw, int fallback) {
        if (FieldNormalizer.isBlank(raw)) return fallback;
        Integer order = FieldNormalizer.parseInt(raw);
        if (order == null) throw new BadRequestException("Display order must be a number");
        return order;
    }
}
