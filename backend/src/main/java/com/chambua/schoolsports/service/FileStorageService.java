package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.StoredFile;
import com.chambua.schoolsports.exception.UploadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes uploads to the upload directory under generated names and removes them again.
 * <p>
 * Files are tied to the surrounding transaction when there is one: a stored file is removed if the
 * transaction rolls back, and files scheduled with {@link #deleteAfterCommit(String)} are removed
 * only once the row change that released them has committed.
 */
@Service
public class FileStorageService {
    private static final Logger log = LoggerFactory.getLogger(FileStorageService.class);

    private static final String URL_SEGMENT = "/uploads/";

    private final Path uploadDir;
    private final String baseUrl;

    public FileStorageService(@Value("${sports.uploads.dir:uploads}") String uploadsDir,
                              @Value("${sports.server-host:localhost}") String serverHost,
                              @Value("${server.port:4002}") int serverPort) {
        this.uploadDir = Paths.get(uploadsDir).toAbsolutePath().normalize();
        this.baseUrl = "http://" + serverHost + ":" + serverPort + URL_SEGMENT;
        try {
            Files.createDirectories(uploadDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create upload directory " + uploadDir, e);
        }
        log.info("[Upload] Upload directory: {}", uploadDir);
    }

    public Path getUploadDir() { return uploadDir; }

    /** Browsers send an empty part for a file input left blank; treat it as no file. */
    public static boolean hasContent(MultipartFile file) {
        return file != null && !file.isEmpty();
    }

    public StoredFile store(MultipartFile file, UploadKind kind) {
        if (file == null || file.isEmpty()) {
            throw UploadException.rejected("Uploaded file is empty");
        }
        String ext = StringUtils.getFilenameExtension(file.getOriginalFilename());
        if (!kind.accepts(ext, file.getContentType())) {
            log.warn("[Upload] Rejected {} ({}) for {}", file.getOriginalFilename(), file.getContentType(), kind);
            throw UploadException.rejected(kind.rejectionMessage());
        }
        String storedName = generateName(kind, ext);
        Path target = uploadDir.resolve(storedName);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target);
        } catch (IOException e) {
            delete(storedName);
            throw UploadException.storageFailed("Failed to store uploaded file", e);
        }
        log.info("[Upload] Stored {} ({} bytes)", storedName, file.getSize());
        removeOnRollback(storedName);
        return new StoredFile(storedName, baseUrl + storedName);
    }

    /** Removes the file if present. Names that would resolve outside the upload directory are ignored. */
    public boolean delete(String storedName) {
        Path path = resolve(storedName);
        if (path == null) return false;
        try {
            boolean removed = Files.deleteIfExists(path);
            if (removed) log.info("[Upload] Removed {}", storedName);
            return removed;
        } catch (IOException e) {
            log.warn("[Upload] Could not remove {}: {}", storedName, e.getMessage());
            return false;
        }
    }

    public boolean deleteByUrl(String url) {
        return delete(storedNameOf(url));
    }

    /**
     * Deletes the file behind {@code url} once the current transaction commits; immediately when no
     * transaction is active. Nothing happens on rollback, so the row keeps a working URL.
     */
    public void deleteAfterCommit(String url) {
        if (url == null) return;
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            deleteByUrl(url);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deleteByUrl(url);
            }
        });
    }

    /** Last path segment of an upload URL, or null when the URL does not point into /uploads/. */
    static String storedNameOf(String url) {
        if (url == null) return null;
        int idx = url.lastIndexOf(URL_SEGMENT);
        if (idx < 0) return null;
        String name = url.substring(idx + URL_SEGMENT.length());
        return name.isEmpty() ? null : name;
    }

    private void removeOnRollback(String storedName) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) return;
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.warn("[Upload] Transaction did not commit, discarding {}", storedName);
                    delete(storedName);
                }
            }
        });
    }

    private Path resolve(String storedName) {
        if (storedName == null || storedName.isBlank()
                || storedName.contains("/") || storedName.contains("\\")) {
            return null;
        }
        Path path = uploadDir.resolve(storedName).normalize();
        return path.getParent() != null && path.getParent().equals(uploadDir) ? path : null;
    }

    private static String generateName(UploadKind kind, String ext) {
        int random = ThreadLocalRandom.current().nextInt(1_000_000_000);
        return kind.prefix() + System.currentTimeMillis() + "-" + random + "." + ext.toLowerCase(Locale.ROOT);
    }
}
