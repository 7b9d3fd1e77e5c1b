package com.chambua.schoolsports.dto;

/** A file written to the upload directory and the absolute URL it is served under. */
public record StoredFile(String storedName, String url) {}
