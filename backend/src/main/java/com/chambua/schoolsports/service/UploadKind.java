package com.chambua.schoolsports.service;

import java.util.Locale;
import java.util.Set;

/**
 * Where an upload is used. Decides the stored filename prefix and which files are accepted.
 */
public enum UploadKind {
    TEAM_IMAGE("team-", Category.IMAGE),
    TEAM_LOGO("team-logo-", Category.IMAGE),
    EVENT_IMAGE("event-", Category.IMAGE),
    NOTICE_SCHEDULE("notice-schedule-", Category.IMAGE),
    NOTICE_DOCUMENT("notice-doc-", Category.PDF);

    private final String prefix;
    private final Category category;

    UploadKind(String prefix, Category category) {
        this.prefix = prefix;
        this.category = category;
    }

    public String prefix() { return prefix; }

    public String rejectionMessage() { return category.rejectionMessage; }

    /** Both the filename extension and the declared mime type must be on the allow-list. */
    public boolean accepts(String extension, String contentType) {
        if (extension == null || contentType == null) return false;
        String ext = extension.toLowerCase(Locale.ROOT);
        String mime = contentType.toLowerCase(Locale.ROOT);
        int semi = mime.indexOf(';');
        if (semi >= 0) mime = mime.substring(0, semi).trim();
        return category.extensions.contains(ext) && category.mimeTypes.contains(mime);
    }

    private enum Category {
        IMAGE(Set.of("jpeg", "jpg", "png", "gif", "webp"),
                Set.of("image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp"),
                "Only image files are allowed!"),
        PDF(Set.of("pdf"), Set.of("application/pdf"), "Only PDF files are allowed!");

        private final Set<String> extensions;
        private final Set<String> mimeTypes;
        private final String rejectionMessage;

        Category(Set<String> extensions, Set<String> mimeTypes, String rejectionMessage) {
            this.extensions = extensions;
            this.mimeTypes = mimeTypes;
            this.rejectionMessage = rejectionMessage;
        }
    }
}
