package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.StoredFile;
import com.chambua.schoolsports.dto.TeamImage;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.util.FieldNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Team photos whose metadata lives in {@code team-images.json} under the data directory rather than
 * in the database. Every read-modify-write of the file holds {@link #lock}.
 */
@Service
public class TeamImageService {
    private static final Logger log = LoggerFactory.getLogger(TeamImageService.class);

    static final String FILE_NAME = "team-images.json";

    private final FileStorageService storage;
    private final ObjectMapper mapper;
    private final Path metadataFile;
    private final ReentrantLock lock = new ReentrantLock();

    public TeamImageService(FileStorageService storage, ObjectMapper mapper,
                            @Value("${sports.data.dir:data}") String dataDir) {
        this.storage = storage;
        this.mapper = mapper;
        this.metadataFile = Paths.get(dataDir).toAbsolutePath().normalize().resolve(FILE_NAME);
    }

    public List<TeamImage> list() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    public TeamImage upload(MultipartFile image, String teamName, String sport) {
        if (!FileStorageService.hasContent(image)) throw new BadRequestException("No file uploaded");
        if (FieldNormalizer.anyBlank(teamName, sport)) throw new BadRequestException("Team name and sport are required");

        StoredFile stored = storage.store(image, UploadKind.TEAM_IMAGE);
        lock.lock();
        try {
            List<TeamImage> images = read();
            TeamImage entry = new TeamImage(nextId(images), stored.url(), teamName.trim(), sport.trim(), stored.storedName());
            images.add(entry);
            write(images);
            log.info("[TeamImages] Added {} for '{}'", entry.getId(), entry.getTeamName());
            return entry;
        } catch (RuntimeException e) {
            storage.delete(stored.storedName());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A new file replaces the stored one; otherwise a non-blank {@code imageUrl} replaces the URL.
     * Team name and sport are always overwritten.
     */
    public TeamImage update(String id, MultipartFile image, String teamName, String sport, String imageUrl) {
        StoredFile stored = FileStorageService.hasContent(image) ? storage.store(image, UploadKind.TEAM_IMAGE) : null;
        String replacedFile = null;
        lock.lock();
        try {
            List<TeamImage> images = read();
            TeamImage entry = find(images, id);
            if (stored != null) {
                replacedFile = entry.getFilename();
                entry.setImageUrl(stored.url());
                entry.setFilename(stored.storedName());
            } else if (!FieldNormalizer.isBlank(imageUrl)) {
                entry.setImageUrl(imageUrl.trim());
            }
            entry.setTeamName(FieldNormalizer.trim(teamName));
            entry.setSport(FieldNormalizer.trim(sport));
            write(images);
            if (replacedFile != null) storage.delete(replacedFile);
            return entry;
        } catch (RuntimeException e) {
            if (stored != null) storage.delete(stored.storedName());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public void delete(String id) {
        lock.lock();
        try {
            List<TeamImage> images = read();
            TeamImage entry = find(images, id);
            images.remove(entry);
            write(images);
            if (entry.getFilename() != null) storage.delete(entry.getFilename());
            log.info("[TeamImages] Removed {}", id);
        } finally {
            lock.unlock();
        }
    }

    private static TeamImage find(List<TeamImage> images, String id) {
        return images.stream()
                .filter(i -> i.getId() != null && i.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Image not found"));
    }

    // Epoch millis, bumped past the newest id when two uploads land in the same millisecond
    private static String nextId(List<TeamImage> images) {
        long id = System.currentTimeMillis();
        for (TeamImage i : images) {
            String existing = i.getId();
            if (existing == null || existing.isEmpty() || existing.length() > 18
                    || !existing.chars().allMatch(Character::isDigit)) {
                continue;
            }
            id = Math.max(id, Long.parseLong(existing) + 1);
        }
        return Long.toString(id);
    }

    private List<TeamImage> read() {
        if (!Files.exists(metadataFile)) return new ArrayList<>();
        try {
            return new ArrayList<>(mapper.readValue(metadataFile.toFile(), new TypeReference<List<TeamImage>>() {}));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + FILE_NAME, e);
        }
    }

    private void write(List<TeamImage> images) {
        try {
            Files.createDirectories(metadataFile.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(metadataFile.toFile(), images);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + FILE_NAME, e);
        }
    }
}
