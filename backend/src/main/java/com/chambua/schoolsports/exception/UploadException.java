package com.chambua.schoolsports.exception;

import org.springframework.http.HttpStatus;

/**
 * Rejected or failed file upload. Type and content problems are the client's (400); a failed
 * write to the upload directory is ours (500).
 */
public class UploadException extends ApiException {

    private UploadException(HttpStatus status, String message, Throwable cause) {
        super(status, message, cause);
    }

    public static UploadException rejected(String message) {
        return new UploadException(HttpStatus.BAD_REQUEST, message, null);
    }

    public static UploadException storageFailed(String message, Throwable cause) {
        return new UploadException(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
